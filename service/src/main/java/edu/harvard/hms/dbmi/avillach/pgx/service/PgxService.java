package edu.harvard.hms.dbmi.avillach.pgx.service;

import java.util.Optional;

import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.AnalysisRequest;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.AnalysisResult;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.AnalysisStatus;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.ServiceInfo;
import edu.harvard.hms.dbmi.avillach.pgx.exception.InvalidGenotypeException;
import edu.harvard.hms.dbmi.avillach.pgx.exception.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RequestMapping(value = "PGX", produces = "application/json")
@RestController
public class PgxService {

	private final AnalysisService analysisService;

	private Logger log = LoggerFactory.getLogger(PgxService.class);

	@Autowired
	public PgxService(AnalysisService analysisService) {
		this.analysisService = analysisService;
	}

	@GetMapping("/info")
	public ServiceInfo info() {
		return analysisService.getInfo();
	}

	@PostMapping("/analysis")
	public ResponseEntity analyze(@RequestBody AnalysisRequest request) {
		try {
			return ResponseEntity.ok(analysisService.submit(request));
		} catch (InvalidGenotypeException | IllegalArgumentException e) {
			return ResponseEntity.status(400).body(e.getMessage());
		} catch (RuntimeException e) {
			log.error("Unable to submit analysis for patient " + request.patientId(), e);
			return ResponseEntity.status(500).build();
		}
	}

	@GetMapping("/analysis/{jobId}/status")
	public ResponseEntity<AnalysisStatus> analysisStatus(@PathVariable("jobId") String jobId) {
		try {
			return ResponseEntity.ok(analysisService.getStatusFor(jobId));
		} catch (JobNotFoundException e) {
			return ResponseEntity.status(404).build();
		}
	}

	@GetMapping("/analysis/{jobId}/result")
	public ResponseEntity analysisResult(@PathVariable("jobId") String jobId) {
		try {
			Optional<AnalysisResult> result = analysisService.getResultFor(jobId);
			if (result.isPresent()) {
				return ResponseEntity.ok(result.get());
			}
			return ResponseEntity.status(400).body("Status : " + analysisService.getStatusFor(jobId).state().name());
		} catch (JobNotFoundException e) {
			return ResponseEntity.status(404).build();
		}
	}

	@PostMapping("/analysis/{jobId}/cancel")
	public ResponseEntity cancel(@PathVariable("jobId") String jobId) {
		try {
			if (!analysisService.cancel(jobId)) {
				return ResponseEntity.status(409).body("Status : " + analysisService.getStatusFor(jobId).state().name());
			}
			return ResponseEntity.ok(analysisService.getStatusFor(jobId));
		} catch (JobNotFoundException e) {
			return ResponseEntity.status(404).build();
		}
	}

	@DeleteMapping("/analysis/{jobId}")
	public ResponseEntity purge(@PathVariable("jobId") String jobId) {
		try {
			analysisService.purge(jobId);
			return ResponseEntity.noContent().build();
		} catch (JobNotFoundException e) {
			return ResponseEntity.status(404).build();
		} catch (IllegalStateException e) {
			return ResponseEntity.status(409).body(e.getMessage());
		}
	}
}
