package edu.harvard.hms.dbmi.avillach.pgx.service;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.*;

import com.google.common.collect.ImmutableMap;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.*;
import edu.harvard.hms.dbmi.avillach.pgx.data.genotype.AlleleCatalog;
import edu.harvard.hms.dbmi.avillach.pgx.data.rule.RuleTable;
import edu.harvard.hms.dbmi.avillach.pgx.exception.InvalidGenotypeException;
import edu.harvard.hms.dbmi.avillach.pgx.exception.JobNotFoundException;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.ExplanationCache;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.ExplanationCacheStats;
import edu.harvard.hms.dbmi.avillach.pgx.processing.generator.ExplanationGenerator;
import edu.harvard.hms.dbmi.avillach.pgx.processing.job.AnalysisJob;
import edu.harvard.hms.dbmi.avillach.pgx.processing.job.DrugAnalysisProcessor;
import edu.harvard.hms.dbmi.avillach.pgx.processing.job.ResultRecordFactory;
import edu.harvard.hms.dbmi.avillach.pgx.service.util.ResultArchive;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Registry and scheduler of analysis jobs. Jobs wait in a priority queue (oldest first) for
 * one of {@code JOB_THREADS} workers; each job spreads its drugs over the shared pool of
 * {@code DRUG_TASK_THREADS} drug workers. Results archived by an earlier run are served
 * read-only until purged.
 */
@Service
public class AnalysisService {

	private static final String SERVICE_NAME = "PGX Guard";

	private final int JOB_THREADS;
	private final int DRUG_TASK_THREADS;

	private final Logger log = LoggerFactory.getLogger(this.getClass());

	private final BlockingQueue<Runnable> jobExecutionQueue;

	private final ThreadPoolExecutor jobExecutor;

	private final ExecutorService drugTaskExecutor;

	private final AlleleCatalog alleleCatalog;
	private final RuleTable ruleTable;
	private final DrugAnalysisProcessor drugAnalysisProcessor;
	private final ResultRecordFactory resultRecordFactory;
	private final ExplanationGenerator explanationGenerator;
	private final ExplanationCache explanationCache;
	private final ResultArchive resultArchive;

	private final ConcurrentHashMap<String, AnalysisJob> jobs = new ConcurrentHashMap<>();

	private final ConcurrentHashMap<String, AnalysisResult> archived = new ConcurrentHashMap<>();

	@Autowired
	public AnalysisService(AlleleCatalog alleleCatalog,
						   RuleTable ruleTable,
						   DrugAnalysisProcessor drugAnalysisProcessor,
						   ResultRecordFactory resultRecordFactory,
						   ExplanationGenerator explanationGenerator,
						   ExplanationCache explanationCache,
						   ResultArchive resultArchive,
						   @Value("${JOB_THREADS:4}") Integer jobThreads,
						   @Value("${DRUG_TASK_THREADS:8}") Integer drugTaskThreads) {
		this.alleleCatalog = alleleCatalog;
		this.ruleTable = ruleTable;
		this.drugAnalysisProcessor = drugAnalysisProcessor;
		this.resultRecordFactory = resultRecordFactory;
		this.explanationGenerator = explanationGenerator;
		this.explanationCache = explanationCache;
		this.resultArchive = resultArchive;

		JOB_THREADS = jobThreads;
		DRUG_TASK_THREADS = drugTaskThreads;

		/* Has to be of type Runnable (nothing more specific) in order
		 * to be compatible with the ThreadPoolExecutor constructor
		 */
		jobExecutionQueue = new PriorityBlockingQueue<Runnable>(1000);
		jobExecutor = new ThreadPoolExecutor(Math.max(1, JOB_THREADS), Math.max(1, JOB_THREADS), 10, TimeUnit.MINUTES, jobExecutionQueue);
		drugTaskExecutor = Executors.newFixedThreadPool(Math.max(1, DRUG_TASK_THREADS));
	}

	@PostConstruct
	public void loadArchive() {
		for (AnalysisResult result : resultArchive.load()) {
			archived.put(result.jobId(), result);
		}
		if (!archived.isEmpty()) {
			log.info("Serving " + archived.size() + " archived analyses");
		}
	}

	/**
	 * Validates every gene and allele of the request before anything is queued.
	 *
	 * @throws InvalidGenotypeException for an unknown gene or missing diplotype, or its subclass
	 *         {@link edu.harvard.hms.dbmi.avillach.pgx.exception.UnknownAlleleException} for an unrecognized allele
	 * @throws IllegalArgumentException for a blank patient id, no drugs, or a blank drug name
	 */
	public AnalysisStatus submit(AnalysisRequest request) {
		validate(request);

		String jobId = UUID.nameUUIDFromBytes(
				(request.patientId() + request.genotypes() + request.drugs() + System.nanoTime()).getBytes(StandardCharsets.UTF_8)
		).toString();
		AnalysisJob job = new AnalysisJob(jobId, request, drugAnalysisProcessor, resultRecordFactory)
				.setQueuedTime(System.currentTimeMillis())
				.setJobQueue(jobExecutor)
				.setDrugQueue(drugTaskExecutor)
				.setCompletionListener(resultArchive::archive);
		jobs.put(jobId, job);
		job.enqueue();
		return getStatusFor(jobId);
	}

	private void validate(AnalysisRequest request) {
		if (request.patientId() == null || request.patientId().isBlank()) {
			throw new IllegalArgumentException("patientId is required");
		}
		if (request.drugs().isEmpty()) {
			throw new IllegalArgumentException("At least one drug is required");
		}
		for (String drug : request.drugs()) {
			if (drug == null || drug.isBlank()) {
				throw new IllegalArgumentException("Drug names must not be blank");
			}
		}
		for (Map.Entry<String, DiplotypeCall> genotype : request.genotypes().entrySet()) {
			if (genotype.getValue() == null) {
				throw new InvalidGenotypeException(genotype.getKey(), "No diplotype given for " + genotype.getKey());
			}
			alleleCatalog.diplotype(genotype.getKey(), genotype.getValue().allele1(), genotype.getValue().allele2());
		}
	}

	public AnalysisStatus getStatusFor(String jobId) {
		List<AnalysisJob> queueSnapshot = queueSnapshot();
		AnalysisResult archivedResult = archived.get(jobId);
		if (archivedResult != null && !jobs.containsKey(jobId)) {
			return new AnalysisStatus(archivedResult.jobId(), archivedResult.patientId(), archivedResult.state(),
					archivedResult.cancelled(), archivedResult.queuedTime(), archivedResult.completedTime(),
					queueSnapshot.size(), -1, archivedResult.drugs());
		}
		AnalysisJob job = find(jobId);
		int position = -1;
		if (job.getState() == JobState.QUEUED) {
			for (int x = 0; x < queueSnapshot.size(); x++) {
				if (queueSnapshot.get(x).getId().equals(jobId)) {
					position = x;
					break;
				}
			}
		}
		job.setQueueDepth(queueSnapshot.size()).setPositionInQueue(position);
		return job.toStatus();
	}

	private List<AnalysisJob> queueSnapshot() {
		List<AnalysisJob> queueSnapshot = new ArrayList<>();
		for (Runnable queued : jobExecutionQueue.toArray(new Runnable[0])) {
			if (queued instanceof AnalysisJob) {
				queueSnapshot.add((AnalysisJob) queued);
			}
		}
		Collections.sort(queueSnapshot);
		return queueSnapshot;
	}

	/**
	 * @return the aggregated result once the job is terminal, otherwise empty
	 */
	public Optional<AnalysisResult> getResultFor(String jobId) {
		AnalysisResult archivedResult = archived.get(jobId);
		if (archivedResult != null && !jobs.containsKey(jobId)) {
			return Optional.of(archivedResult);
		}
		return Optional.ofNullable(find(jobId).toResult());
	}

	/**
	 * @return false when the job had already finished
	 */
	public boolean cancel(String jobId) {
		if (archived.containsKey(jobId) && !jobs.containsKey(jobId)) {
			return false;
		}
		AnalysisJob job = find(jobId);
		boolean cancelled = job.cancel();
		if (cancelled) {
			jobExecutor.remove(job);
		}
		return cancelled;
	}

	/**
	 * Forgets a finished job and removes its archived result.
	 *
	 * @throws IllegalStateException when the job is still queued or running
	 */
	public void purge(String jobId) {
		if (archived.remove(jobId) != null && !jobs.containsKey(jobId)) {
			resultArchive.delete(jobId);
			log.info("Purged archived analysis " + jobId);
			return;
		}
		AnalysisJob job = find(jobId);
		if (!job.getState().isTerminal()) {
			throw new IllegalStateException("Analysis " + jobId + " is " + job.getState() + " and cannot be purged");
		}
		jobs.remove(jobId, job);
		resultArchive.delete(jobId);
		log.info("Purged analysis " + jobId);
	}

	public ServiceInfo getInfo() {
		ExplanationCacheStats stats = explanationCache.stats();
		return new ServiceInfo(
				SERVICE_NAME,
				explanationGenerator.provider(),
				explanationGenerator.model(),
				List.copyOf(new TreeSet<>(alleleCatalog.getGeneSymbols())),
				List.copyOf(new TreeSet<>(ruleTable.getDrugs())),
				ImmutableMap.of(
						"entries", (long) stats.entries(),
						"hits", stats.hits(),
						"misses", stats.misses(),
						"writes", stats.writes(),
						"conflicts", stats.conflicts())
		);
	}

	private AnalysisJob find(String jobId) {
		AnalysisJob job = jobs.get(jobId);
		if (job == null) {
			throw new JobNotFoundException(jobId);
		}
		return job;
	}

	@PreDestroy
	public void shutdown() {
		jobExecutor.shutdownNow();
		drugTaskExecutor.shutdownNow();
	}
}
