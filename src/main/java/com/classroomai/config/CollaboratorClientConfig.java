package com.classroomai.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient beans for the HTTP collaborators (face recognition and answer generation).
 * Response timeouts sit slightly above the session-level timeouts so the session decides first.
 */
@Configuration
public class CollaboratorClientConfig {

    private final ClassroomProperties properties;

    public CollaboratorClientConfig(ClassroomProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient attendanceWebClient(WebClient.Builder builder) {
        return build(builder,
                properties.getCollaborators().getAttendance().getBaseUrl(),
                properties.getSession().getCollaboratorTimeout());
    }

    @Bean
    public WebClient answerWebClient(WebClient.Builder builder) {
        return build(builder,
                properties.getCollaborators().getAnswer().getBaseUrl(),
                properties.getSession().getAnswerTimeout());
    }

    private WebClient build(WebClient.Builder builder, String baseUrl, long timeoutMillis) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000) // 5s connect
                .responseTimeout(Duration.ofMillis(timeoutMillis + 1_000));

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(2 * 1024 * 1024)) // 2MB, attendance photos are inline
                .build();
    }
}
