package edu.harvard.hms.dbmi.avillach.pgx.processing.job;

import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.DrugOutcome;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.DrugState;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.FailureStage;
import edu.harvard.hms.dbmi.avillach.pgx.processing.PhenotypeCall;
import edu.harvard.hms.dbmi.avillach.pgx.processing.RiskAssessment;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.DrugExplanation;

/**
 * Progress and outcome of one drug within an analysis job. Every transition is checked
 * against {@link DrugState#canAdvanceTo}, so a drug never moves backwards and a terminal
 * drug is never changed again. Transition methods return false when they were refused.
 */
public class DrugTask {

	private final String drug;

	private DrugState state = DrugState.PENDING;

	private PhenotypeCall phenotypeCall;

	private RiskAssessment assessment;

	private DrugExplanation explanation;

	private FailureStage failureStage;

	private String failureReason;

	public DrugTask(String drug) {
		this.drug = drug;
	}

	public String getDrug() {
		return drug;
	}

	public synchronized DrugState getState() {
		return state;
	}

	public synchronized boolean isTerminal() {
		return state.isTerminal();
	}

	public synchronized boolean advance(DrugState next) {
		if (!state.canAdvanceTo(next) || next.isTerminal()) {
			return false;
		}
		state = next;
		return true;
	}

	public synchronized boolean recordVerdict(PhenotypeCall phenotypeCall, RiskAssessment assessment) {
		if (state.isTerminal()) {
			return false;
		}
		this.phenotypeCall = phenotypeCall;
		this.assessment = assessment;
		return true;
	}

	public synchronized boolean complete(DrugExplanation explanation) {
		if (!state.canAdvanceTo(DrugState.DONE)) {
			return false;
		}
		this.explanation = explanation;
		this.state = DrugState.DONE;
		return true;
	}

	public synchronized boolean fail(FailureStage stage, String reason) {
		if (!state.canAdvanceTo(DrugState.FAILED)) {
			return false;
		}
		this.failureStage = stage;
		this.failureReason = reason;
		this.state = DrugState.FAILED;
		return true;
	}

	public synchronized DrugOutcome getOutcome() {
		if (assessment == null) {
			return DrugOutcome.NO_VERDICT;
		}
		return explanation == null ? DrugOutcome.VERDICT_ONLY : DrugOutcome.COMPLETE;
	}

	public synchronized PhenotypeCall getPhenotypeCall() {
		return phenotypeCall;
	}

	public synchronized RiskAssessment getAssessment() {
		return assessment;
	}

	public synchronized DrugExplanation getExplanation() {
		return explanation;
	}

	public synchronized FailureStage getFailureStage() {
		return failureStage;
	}

	public synchronized String getFailureReason() {
		return failureReason;
	}
}
