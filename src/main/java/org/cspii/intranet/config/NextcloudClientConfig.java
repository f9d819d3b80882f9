package org.cspii.intranet.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

@Slf4j
@Configuration
@Profile("!test")
public class NextcloudClientConfig {

    // Group folder app endpoints require this header, otherwise they answer 997
    private static final String OCS_API_REQUEST_HEADER = "OCS-APIRequest";

    @Value("${app.client.nextcloud.url}")
    private String nextcloudUrl;

    @Value("${app.client.nextcloud.username}")
    private String nextcloudUsername;

    @Value("${app.client.nextcloud.password}")
    private String nextcloudPassword;

    @Value("${app.client.nextcloud.timeout-seconds:30}")
    private long timeoutSeconds;

    @Bean
    @Qualifier("nextcloudRestTemplate")
    public RestTemplate nextcloudRestTemplate(RestTemplateBuilder builder) {
        log.info("Initializing nextcloudRestTemplate for {}", nextcloudUrl);
        return builder
                .rootUri(nextcloudUrl + "/ocs/v2.php")
                .basicAuthentication(nextcloudUsername, nextcloudPassword)
                .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .additionalInterceptors((request, body, execution) -> {
                    request.getHeaders().set(OCS_API_REQUEST_HEADER, "true");
                    request.getHeaders().setAccept(List.of(MediaType.APPLICATION_JSON));
                    log.debug("Making Nextcloud request: {} {}", request.getMethod(), request.getURI());
                    var response = execution.execute(request, body);
                    log.debug("Nextcloud response status: {}", response.getStatusCode());
                    return response;
                })
                .build();
    }
}
