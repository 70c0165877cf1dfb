package edu.harvard.hms.dbmi.avillach.pgx.processing.generator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import edu.harvard.hms.dbmi.avillach.pgx.exception.GeneratorUnavailableException;
import edu.harvard.hms.dbmi.avillach.pgx.processing.explanation.ExplanationPrompt;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for an OpenAI-compatible chat completions endpoint.
 */
public class ExplanationGeneratorRestClient implements ExplanationGenerator {

    static final String PROVIDER = "openai-compatible";

    private final WebClient webClient;

    private final String model;

    public ExplanationGeneratorRestClient(String serviceUrl, String apiKey, String model) {
        this(buildWebClient(serviceUrl, apiKey), model);
    }

    public ExplanationGeneratorRestClient(WebClient webClient, String model) {
        this.webClient = webClient;
        this.model = model;
    }

    private static WebClient buildWebClient(String serviceUrl, String apiKey) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(serviceUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return builder.build();
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public Mono<String> generate(ExplanationPrompt prompt) {
        ChatCompletionRequest request = new ChatCompletionRequest(
                model,
                List.of(new Message("system", prompt.getSystemRole()), new Message("user", prompt.getUserText())),
                prompt.getMaxTokens(),
                prompt.getTemperature()
        );
        return webClient.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> statusFailure(response.statusCode(), body)))
                .bodyToMono(ChatCompletionResponse.class)
                .map(this::content)
                .onErrorMap(e -> !(e instanceof GeneratorUnavailableException), ExplanationGeneratorRestClient::failure);
    }

    /**
     * Anything the exchange throws becomes a {@link GeneratorUnavailableException}: connection
     * problems are retryable, a reply that cannot be read as a chat completion is not.
     */
    static GeneratorUnavailableException failure(Throwable e) {
        if (e instanceof WebClientRequestException) {
            return new GeneratorUnavailableException("Unable to reach explanation generator: " + e.getMessage(), true, e);
        }
        if (e instanceof WebClientResponseException && ((WebClientResponseException) e).getStatusCode().isError()) {
            WebClientResponseException response = (WebClientResponseException) e;
            GeneratorUnavailableException failure = statusFailure(response.getStatusCode(), response.getResponseBodyAsString());
            failure.initCause(e);
            return failure;
        }
        return new GeneratorUnavailableException("Unreadable reply from explanation generator: " + e.getMessage(), false, e);
    }

    static GeneratorUnavailableException statusFailure(HttpStatusCode status, String body) {
        // rate limiting and server faults are worth another attempt, any other client error is not
        boolean retryable = status.is5xxServerError() || status.value() == 429;
        return new GeneratorUnavailableException("Explanation generator returned " + status.value() + ": " + body, retryable);
    }

    private String content(ChatCompletionResponse response) {
        if (response.choices() == null || response.choices().isEmpty()
                || response.choices().get(0).message() == null) {
            throw new GeneratorUnavailableException("Explanation generator returned no choices", false);
        }
        String content = response.choices().get(0).message().content();
        if (content == null || content.isBlank()) {
            throw new GeneratorUnavailableException("Explanation generator returned an empty message", false);
        }
        return content.trim();
    }

    record ChatCompletionRequest(
        String model,
        List<Message> messages,
        @JsonProperty("max_tokens") int maxTokens,
        double temperature
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatCompletionResponse(List<Choice> choices) {
    }
}
