package dev.feedlib.fetch;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} and worker pool used by {@link FeedFetcher}.
 *
 * <p>The transport never follows redirects itself: {@link FeedFetcher} follows them hop by hop so
 * every target passes the {@link AddressGuard}.
 */
@Configuration
public class FetchConfig {

    /**
     * Creates the REST client shared by direct fetches and relay calls.
     *
     * @param builder Spring-provided builder with common defaults
     * @param properties fetcher settings
     * @return a named REST client bean for injection into {@link FeedFetcher} and
     *     {@link ProxyRelayClient}
     */
    @Bean
    public RestClient feedFetchRestClient(RestClient.Builder builder, FetchProperties properties) {
        return builder
                .requestFactory(noRedirectRequestFactory(properties))
                .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
                .build();
    }

    /**
     * Worker pool backing {@link FeedFetcher#readAsync}.
     *
     * @param properties fetcher settings
     * @return an executor shut down with the context
     */
    @Bean
    public ThreadPoolTaskExecutor feedFetchExecutor(FetchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.asyncPoolSize());
        executor.setMaxPoolSize(properties.asyncPoolSize());
        executor.setThreadNamePrefix("feed-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    static SimpleClientHttpRequestFactory noRedirectRequestFactory(FetchProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod)
                    throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));
        return requestFactory;
    }
}
