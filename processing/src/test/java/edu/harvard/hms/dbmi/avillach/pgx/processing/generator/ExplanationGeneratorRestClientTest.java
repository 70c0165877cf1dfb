package edu.harvard.hms.dbmi.avillach.pgx.processing.generator;

import edu.harvard.hms.dbmi.avillach.pgx.exception.GeneratorUnavailableException;
import edu.harvard.hms.dbmi.avillach.pgx.processing.PhenotypeCall;
import edu.harvard.hms.dbmi.avillach.pgx.processing.RiskAssessment;
import edu.harvard.hms.dbmi.avillach.pgx.processing.TestCatalogs;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.ExplanationPrompt;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.PromptBuilder;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.PromptTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class ExplanationGeneratorRestClientTest {

	private ExplanationPrompt prompt;

	@BeforeEach
	public void setup() {
		PhenotypeCall call = TestCatalogs.resolver().call("CYP2C19", "*2", "*2");
		RiskAssessment assessment = TestCatalogs.classifier().classify(call.gene(), call.phenotype(), "Clopidogrel");
		prompt = new PromptBuilder().build(PromptTemplate.RISK_EXPLANATION, call, assessment);
	}

	private static ExplanationGeneratorRestClient clientAnswering(HttpStatus status, String body, AtomicReference<ClientRequest> seen) {
		return clientAnswering(status, MediaType.APPLICATION_JSON_VALUE, body, seen);
	}

	private static ExplanationGeneratorRestClient clientAnswering(HttpStatus status, String contentType, String body,
																   AtomicReference<ClientRequest> seen) {
		WebClient webClient = WebClient.builder()
				.baseUrl("http://generator.test/v1")
				.exchangeFunction(request -> {
					if (seen != null) {
						seen.set(request);
					}
					return Mono.just(ClientResponse.create(status)
							.header(HttpHeaders.CONTENT_TYPE, contentType)
							.body(body)
							.build());
				})
				.build();
		return new ExplanationGeneratorRestClient(webClient, "gpt-3.5-turbo");
	}

	@Test
	public void readsTheFirstChoice() {
		AtomicReference<ClientRequest> seen = new AtomicReference<>();
		ExplanationGeneratorRestClient client = clientAnswering(HttpStatus.OK,
				"{\"id\":\"c1\",\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\" Clopidogrel will not work well. \"}}]}",
				seen);

		assertEquals("Clopidogrel will not work well.", client.generate(prompt).block());
		assertEquals(HttpMethod.POST, seen.get().method());
		assertEquals(URI.create("http://generator.test/v1/chat/completions"), seen.get().url());
		assertEquals("openai-compatible/gpt-3.5-turbo", client.versionTag());
	}

	@Test
	public void serverErrorIsRetryable() {
		GeneratorUnavailableException e = assertThrows(GeneratorUnavailableException.class,
				() -> clientAnswering(HttpStatus.SERVICE_UNAVAILABLE, "{}", null).generate(prompt).block());
		assertTrue(e.isRetryable());
	}

	@Test
	public void rateLimitIsRetryable() {
		GeneratorUnavailableException e = assertThrows(GeneratorUnavailableException.class,
				() -> clientAnswering(HttpStatus.TOO_MANY_REQUESTS, "{}", null).generate(prompt).block());
		assertTrue(e.isRetryable());
	}

	@Test
	public void clientErrorIsNotRetryable() {
		GeneratorUnavailableException e = assertThrows(GeneratorUnavailableException.class,
				() -> clientAnswering(HttpStatus.UNAUTHORIZED, "{\"error\":\"bad key\"}", null).generate(prompt).block());
		assertFalse(e.isRetryable());
		assertTrue(e.getMessage().contains("401"));
	}

	@Test
	public void emptyReplyIsNotRetryable() {
		GeneratorUnavailableException e = assertThrows(GeneratorUnavailableException.class,
				() -> clientAnswering(HttpStatus.OK, "{\"choices\":[]}", null).generate(prompt).block());
		assertFalse(e.isRetryable());
	}

	@Test
	public void connectionFailureIsRetryable() {
		WebClient webClient = WebClient.builder()
				.exchangeFunction(request -> Mono.error(new WebClientRequestException(new ConnectException("refused"),
						request.method(), request.url(), request.headers())))
				.build();
		ExplanationGeneratorRestClient client = new ExplanationGeneratorRestClient(webClient, "gpt-3.5-turbo");

		GeneratorUnavailableException e = assertThrows(GeneratorUnavailableException.class, () -> client.generate(prompt).block());
		assertTrue(e.isRetryable());
	}

	@Test
	public void htmlPageInsteadOfJsonIsNotRetryable() {
		ExplanationGeneratorRestClient client = clientAnswering(HttpStatus.OK, MediaType.TEXT_HTML_VALUE,
				"<html>proxy login</html>", null);

		GeneratorUnavailableException e = assertThrows(GeneratorUnavailableException.class, () -> client.generate(prompt).block());
		assertFalse(e.isRetryable());
		assertNotNull(e.getCause());
	}

	@Test
	public void malformedJsonIsNotRetryable() {
		ExplanationGeneratorRestClient client = clientAnswering(HttpStatus.OK, "{\"choices\": [", null);

		GeneratorUnavailableException e = assertThrows(GeneratorUnavailableException.class, () -> client.generate(prompt).block());
		assertFalse(e.isRetryable());
	}
}
