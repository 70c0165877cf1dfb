package edu.harvard.hms.dbmi.avillach.pgx.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.io.output.ByteArrayOutputStream;

import java.io.*;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

public abstract class FileBackedJsonIndexStorage <K, V extends Serializable> extends FileBackedByteIndexedStorage<K, V> {

    protected final ObjectMapper objectMapper;

    public FileBackedJsonIndexStorage(File storageFile) {
        this(storageFile, new ObjectMapper());
    }

    public FileBackedJsonIndexStorage(File storageFile, ObjectMapper objectMapper) {
        super(storageFile);
        this.objectMapper = objectMapper;
    }

    protected ByteArrayOutputStream writeObject(V value) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzipOutputStream = new GZIPOutputStream(out)) {
            objectMapper.writeValue(gzipOutputStream, value);
        }
        return out;
    }

    protected V readObject(byte[] buffer) {
        try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(buffer))) {
            return objectMapper.readValue(gzipInputStream, getTypeReference());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public abstract TypeReference<V> getTypeReference();
}
