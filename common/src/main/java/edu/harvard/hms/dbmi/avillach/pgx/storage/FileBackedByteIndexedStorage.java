package edu.harvard.hms.dbmi.avillach.pgx.storage;

import org.apache.commons.io.output.ByteArrayOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only store of serialized records in a single file. Each record is written as a
 * four byte length followed by the encoded value, and records are never rewritten in place.
 * The in-memory index maps a key to the offset and length of its record; it is rebuilt
 * by scanning the file when the store is opened, so the file alone is the durable state.
 *
 * A record that was only partially written when the process died is detected during the
 * scan and cut off the end of the file. An append that fails part way is cut off at once, so
 * records appended after it stay readable. {@link #open()} must be called before the store is used.
 */
public abstract class FileBackedByteIndexedStorage <K, V extends Serializable> implements Closeable {

	private static final Logger log = LoggerFactory.getLogger(FileBackedByteIndexedStorage.class);

	private static final int LENGTH_PREFIX_BYTES = Integer.BYTES;

	protected final ConcurrentHashMap<K, Long[]> index = new ConcurrentHashMap<>();
	protected final File storageFile;
	protected volatile RandomAccessFile storage;

	/** Offset just past the last complete record; appends start here. */
	private long endOfRecords;

	public FileBackedByteIndexedStorage(File storageFile) {
		this.storageFile = storageFile;
	}

	/**
	 * Opens the backing file, creating it if needed, and rebuilds the index from its records.
	 */
	public synchronized void open() throws IOException {
		if (storage != null) {
			return;
		}
		storage = new RandomAccessFile(storageFile, "rwd");
		recover();
	}

	public Set<K> keys() {
		return index.keySet();
	}

	public int size() {
		return index.size();
	}

	public boolean containsKey(K key) {
		return index.containsKey(key);
	}

	/**
	 * Appends the value unless a record already exists for the key.
	 *
	 * @return the value stored under the key after this call, which is the existing record when one was present
	 */
	public V putIfAbsent(K key, V value) throws IOException {
		ensureOpen();
		synchronized (storage) {
			V existing = get(key);
			if (existing != null) {
				return existing;
			}
			byte[] bytes;
			try (ByteArrayOutputStream out = writeObject(value)) {
				bytes = out.toByteArray();
			}
			long recordStart = endOfRecords;
			try {
				if (storage.length() > recordStart) {
					log.warn("Dropping " + (storage.length() - recordStart) + " bytes of incomplete record data from " + storageFile);
					storage.setLength(recordStart);
				}
				storage.seek(recordStart);
				storage.writeInt(bytes.length);
				storage.write(bytes);
			} catch (IOException e) {
				rollback(recordStart, e);
				throw e;
			}
			endOfRecords = recordStart + LENGTH_PREFIX_BYTES + bytes.length;
			index.put(key, new Long[] {recordStart + LENGTH_PREFIX_BYTES, (long) bytes.length});
			return value;
		}
	}

	public V get(K key) {
		Long[] offsetsInStorage = index.get(key);
		if (offsetsInStorage == null) {
			return null;
		}
		byte[] buffer = new byte[offsetsInStorage[1].intValue()];
		try {
			ensureOpen();
			synchronized (storage) {
				storage.seek(offsetsInStorage[0]);
				storage.readFully(buffer);
			}
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return readObject(buffer);
	}

	private void rollback(long recordStart, IOException cause) {
		try {
			storage.setLength(recordStart);
		} catch (IOException e) {
			cause.addSuppressed(e);
			log.error("Unable to cut failed append off " + storageFile + " at offset " + recordStart, e);
		}
	}

	private void recover() throws IOException {
		synchronized (storage) {
			long length = storage.length();
			long position = 0;
			while (length - position >= LENGTH_PREFIX_BYTES) {
				storage.seek(position);
				int recordLength = storage.readInt();
				if (recordLength <= 0 || position + LENGTH_PREFIX_BYTES + recordLength > length) {
					break;
				}
				byte[] buffer = new byte[recordLength];
				storage.readFully(buffer);
				V value;
				try {
					value = readObject(buffer);
				} catch (UncheckedIOException e) {
					log.warn("Unreadable record at offset " + position + " of " + storageFile, e);
					break;
				}
				index.put(keyOf(value), new Long[] {position + LENGTH_PREFIX_BYTES, (long) recordLength});
				position += LENGTH_PREFIX_BYTES + recordLength;
			}
			if (position < length) {
				log.warn("Truncating " + (length - position) + " bytes of incomplete record data from " + storageFile);
				storage.setLength(position);
			}
			endOfRecords = position;
		}
		log.info("Opened " + storageFile + " with " + index.size() + " records");
	}

	private void ensureOpen() throws IOException {
		if (storage == null) {
			open();
		}
	}

	@Override
	public synchronized void close() throws IOException {
		if (storage != null) {
			synchronized (storage) {
				storage.close();
			}
			storage = null;
		}
	}

	/**
	 * The key a record is indexed under, read back from the record itself when the file is scanned.
	 */
	protected abstract K keyOf(V value);

	protected abstract V readObject(byte[] buffer);

	protected abstract ByteArrayOutputStream writeObject(V value) throws IOException;

}
