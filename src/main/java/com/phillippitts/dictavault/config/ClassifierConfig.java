package com.phillippitts.dictavault.config;

import com.phillippitts.dictavault.config.properties.ClassifierProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP wiring for the language-model classifier.
 *
 * <p>The read timeout matches {@code privacy.classifier.timeout-ms} so a hung model server
 * releases the pool thread at about the same time the caller gives up on the future.
 */
@Configuration
public class ClassifierConfig {

    @Bean(name = "classifierRestClient")
    public RestClient classifierRestClient(ClassifierProperties props) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(props.getConnectTimeoutMs());
        factory.setReadTimeout((int) Math.min(Integer.MAX_VALUE, props.getTimeoutMs()));
        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(factory)
                .build();
    }
}
