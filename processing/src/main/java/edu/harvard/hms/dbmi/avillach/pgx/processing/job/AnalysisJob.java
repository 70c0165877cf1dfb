package edu.harvard.hms.dbmi.avillach.pgx.processing.job;

import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * One submitted analysis. The job runs on a worker of the job queue and fans its drugs out
 * to the drug queue, waiting for all of them. The job state only moves forward; it ends
 * COMPLETED once every drug is terminal (including by cancellation) and FAILED only when the
 * orchestration itself broke. A fault inside one drug fails that drug alone.
 */
public class AnalysisJob implements Runnable, Comparable<AnalysisJob> {

	private static Logger log = LoggerFactory.getLogger(AnalysisJob.class);

	private final String id;

	private final String patientId;

	private final Map<String, DiplotypeCall> genotypes;

	private final List<DrugTask> drugTasks;

	private final DrugAnalysisProcessor processor;

	private final ResultRecordFactory resultRecordFactory;

	private JobState state = JobState.QUEUED;

	private boolean cancelled;

	private long queuedTime;

	private long startedTime;

	private Long completedTime;

	private volatile int queueDepth;

	private volatile int positionInQueue = -1;

	private final List<Future<?>> drugFutures = new ArrayList<>();

	private ExecutorService jobQueue;

	private ExecutorService drugQueue;

	private Consumer<AnalysisJob> completionListener;

	public AnalysisJob(String id, AnalysisRequest request, DrugAnalysisProcessor processor, ResultRecordFactory resultRecordFactory) {
		this.id = id;
		this.patientId = request.patientId();
		this.genotypes = Map.copyOf(request.genotypes());
		List<DrugTask> tasks = new ArrayList<>();
		for (String drug : request.drugs()) {
			tasks.add(new DrugTask(drug.trim()));
		}
		this.drugTasks = List.copyOf(tasks);
		this.processor = processor;
		this.resultRecordFactory = resultRecordFactory;
	}

	public String getId() {
		return id;
	}

	public String getPatientId() {
		return patientId;
	}

	public List<DrugTask> getDrugTasks() {
		return drugTasks;
	}

	public synchronized JobState getState() {
		return state;
	}

	public synchronized boolean isCancelled() {
		return cancelled;
	}

	public long getQueuedTime() {
		return queuedTime;
	}

	public AnalysisJob setQueuedTime(long queuedTime) {
		this.queuedTime = queuedTime;
		return this;
	}

	public synchronized Long getCompletedTime() {
		return completedTime;
	}

	public AnalysisJob setQueueDepth(int queueDepth) {
		this.queueDepth = queueDepth;
		return this;
	}

	public AnalysisJob setPositionInQueue(int positionInQueue) {
		this.positionInQueue = positionInQueue;
		return this;
	}

	public AnalysisJob setJobQueue(ExecutorService jobQueue) {
		this.jobQueue = jobQueue;
		return this;
	}

	public AnalysisJob setDrugQueue(ExecutorService drugQueue) {
		this.drugQueue = drugQueue;
		return this;
	}

	/**
	 * Called once, with the job already terminal.
	 */
	public AnalysisJob setCompletionListener(Consumer<AnalysisJob> completionListener) {
		this.completionListener = completionListener;
		return this;
	}

	@Override
	public void run() {
		synchronized (this) {
			if (state != JobState.QUEUED) {
				return;
			}
			state = JobState.RUNNING;
			startedTime = System.currentTimeMillis();
		}
		log.info("Started analysis " + id + " after " + (startedTime - queuedTime) + "ms in queue");
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (DrugTask task : drugTasks) {
				Future<?> future = drugQueue.submit(() -> processor.process(task, genotypes));
				futures.add(future);
				synchronized (this) {
					drugFutures.add(future);
					if (cancelled) {
						future.cancel(false);
					}
				}
			}
			for (int x = 0; x < futures.size(); x++) {
				awaitDrug(drugTasks.get(x), futures.get(x));
			}
			if (finish(JobState.COMPLETED)) {
				log.info("Ran analysis " + id + " in " + (System.currentTimeMillis() - startedTime) + "ms for "
						+ drugTasks.size() + " drugs");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			log.error("Analysis " + id + " interrupted after " + (System.currentTimeMillis() - startedTime) + "ms", e);
			failOrchestration("interrupted");
		} catch (RuntimeException e) {
			log.error("Analysis " + id + " failed in " + (System.currentTimeMillis() - startedTime) + "ms", e);
			failOrchestration(e.getMessage());
		}
	}

	private void awaitDrug(DrugTask task, Future<?> future) throws InterruptedException {
		try {
			future.get();
		} catch (CancellationException e) {
			// the job was cancelled before this drug finished
		} catch (ExecutionException e) {
			log.error("Drug " + task.getDrug() + " of analysis " + id + " failed", e.getCause());
			task.fail(FailureStage.ORCHESTRATION, String.valueOf(e.getCause().getMessage()));
		}
	}

	public void enqueue() {
		try {
			this.jobQueue.execute(this);
			log.info("Queued analysis " + id + " for " + drugTasks.size() + " drugs");
		} catch (RejectedExecutionException e) {
			log.error("Analysis " + id + " was rejected by the job queue", e);
			failOrchestration("rejected by the job queue");
		}
	}

	/**
	 * Fails every drug still in progress and completes the job. Cache entries already
	 * written stay in place.
	 *
	 * @return false when the job had already finished
	 */
	public boolean cancel() {
		synchronized (this) {
			if (state.isTerminal()) {
				return false;
			}
			cancelled = true;
			for (DrugTask task : drugTasks) {
				task.fail(FailureStage.CANCELLED, "cancelled");
			}
			// drugs already running stop at their next check of the task state
			for (Future<?> future : drugFutures) {
				future.cancel(false);
			}
		}
		boolean finished = finish(JobState.COMPLETED);
		if (finished) {
			log.info("Cancelled analysis " + id);
		}
		return finished;
	}

	private void failOrchestration(String reason) {
		synchronized (this) {
			if (state.isTerminal()) {
				return;
			}
			for (DrugTask task : drugTasks) {
				task.fail(FailureStage.ORCHESTRATION, reason);
			}
		}
		finish(JobState.FAILED);
	}

	private boolean finish(JobState terminal) {
		synchronized (this) {
			if (state.isTerminal()) {
				return false;
			}
			state = terminal;
			completedTime = System.currentTimeMillis();
		}
		if (completionListener != null) {
			completionListener.accept(this);
		}
		return true;
	}

	/**
	 * Drug details are only exposed once the job is terminal; before that only drug states are shown.
	 */
	public AnalysisStatus toStatus() {
		JobState currentState;
		boolean currentCancelled;
		Long currentCompletedTime;
		synchronized (this) {
			currentState = state;
			currentCancelled = cancelled;
			currentCompletedTime = completedTime;
		}
		List<DrugStatus> drugs = new ArrayList<>();
		for (DrugTask task : drugTasks) {
			drugs.add(currentState.isTerminal() ? finalStatus(task) : DrugStatus.inProgress(task.getDrug(), task.getState()));
		}
		return new AnalysisStatus(id, patientId, currentState, currentCancelled, queuedTime, currentCompletedTime,
				queueDepth, positionInQueue, drugs);
	}

	/**
	 * @return the aggregated result, or null while the job is still queued or running
	 */
	public AnalysisResult toResult() {
		synchronized (this) {
			if (!state.isTerminal()) {
				return null;
			}
		}
		List<DrugStatus> drugs = new ArrayList<>();
		for (DrugTask task : drugTasks) {
			drugs.add(finalStatus(task));
		}
		return new AnalysisResult(id, patientId, getState(), isCancelled(), queuedTime, getCompletedTime(), drugs);
	}

	private DrugStatus finalStatus(DrugTask task) {
		return new DrugStatus(task.getDrug(), task.getState(), task.getOutcome(), task.getFailureStage(),
				task.getFailureReason(), resultRecordFactory.create(patientId, task, genotypes.size()));
	}

	@Override
	public int compareTo(AnalysisJob o) {
		int byQueuedTime = Long.compare(this.queuedTime, o.queuedTime);
		return byQueuedTime != 0 ? byQueuedTime : this.id.compareTo(o.id);
	}
}
