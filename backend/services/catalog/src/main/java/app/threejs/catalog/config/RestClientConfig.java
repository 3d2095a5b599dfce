package app.threejs.catalog.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class RestClientConfig {

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_DOWNLOAD_TIMEOUT = Duration.ofSeconds(300);

    @Bean
    public RestClient sketchfabRestClient(SketchfabProps props) {
        return RestClient.builder()
                .baseUrl(props.apiUrl())
                .requestFactory(requestFactory(props.connectTimeout(), null))
                .build();
    }

    @Bean
    public RestClient sketchfabDownloadRestClient(SketchfabProps props) {
        Duration readTimeout = props.downloadTimeout() == null ? DEFAULT_DOWNLOAD_TIMEOUT : props.downloadTimeout();
        return RestClient.builder()
                .requestFactory(requestFactory(props.connectTimeout(), readTimeout))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private JdkClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        if (readTimeout != null) {
            factory.setReadTimeout(readTimeout);
        }
        return factory;
    }
}
