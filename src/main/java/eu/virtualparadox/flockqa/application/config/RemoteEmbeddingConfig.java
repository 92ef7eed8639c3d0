package eu.virtualparadox.flockqa.application.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the hosted embedding model. Without {@code flockqa.embedding.remote.api-key} no bean is
 * created and the remote encoder reports itself unavailable.
 */
@Configuration
@Slf4j
public class RemoteEmbeddingConfig {

    @Bean
    @ConditionalOnExpression("!'${flockqa.embedding.remote.api-key:}'.isBlank()")
    public EmbeddingModel remoteEmbeddingModel(final ApplicationConfig config) {
        final ApplicationConfig.Remote remote = config.getEmbedding().getRemote();
        final OpenAiApi api = OpenAiApi.builder()
                .apiKey(remote.getApiKey())
                .baseUrl(remote.getBaseUrl())
                .build();

        log.info("Remote embedding model {} at {}", remote.getModel(), remote.getBaseUrl());
        return new OpenAiEmbeddingModel(api, MetadataMode.EMBED,
                OpenAiEmbeddingOptions.builder().model(remote.getModel()).build());
    }
}
