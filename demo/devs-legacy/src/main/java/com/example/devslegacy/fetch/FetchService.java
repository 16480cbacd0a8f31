package com.example.devslegacy.fetch;

import com.example.devslegacy.config.DevsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Outbound GET for URLs that already passed {@link com.example.devslegacy.validation.UrlValidationPolicy}.
 * Redirects are followed without looking at the intermediate hops again.
 */
@Service
public class FetchService {

    private static final Logger log = LoggerFactory.getLogger(FetchService.class);

    private final RestTemplate fetchRestTemplate;
    private final AsyncTaskExecutor fetchExecutor;
    private final DevsProperties.Fetch props;

    @Autowired
    public FetchService(RestTemplate fetchRestTemplate,
                        @Qualifier("fetchExecutor") AsyncTaskExecutor fetchExecutor,
                        DevsProperties props) {
        this(fetchRestTemplate, fetchExecutor, props.fetch());
    }

    FetchService(RestTemplate fetchRestTemplate, AsyncTaskExecutor fetchExecutor, DevsProperties.Fetch props) {
        this.fetchRestTemplate = fetchRestTemplate;
        this.fetchExecutor = fetchExecutor;
        this.props = props;
    }

    public FetchResult fetch(String url) throws FetchException {
        log.debug("fetching {}", url);
        Future<ResponseEntity<String>> pending = null;

        ResponseEntity<String> response;
        try {
            pending = fetchExecutor.submit(() -> get(url));
            // one deadline for connect, headers and body together
            response = pending.get(props.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TaskRejectedException e) {
            throw new FetchNetworkException(url, e);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new FetchTimeoutException(url, props.timeout(), e);
        } catch (ExecutionException e) {
            throw classify(url, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new FetchNetworkException(url, e);
        }

        FetchResult result = FetchResult.of(response.getStatusCode().value(), url, response.getBody(),
                props.maxBodyChars(), props.truncationMarker());
        log.debug("fetched {} -> {} ({} chars, truncated={})",
                url, result.statusCode(), result.body().length(), result.truncated());
        return result;
    }

    private ResponseEntity<String> get(String url) {
        return fetchRestTemplate.exchange(URI.create(url), HttpMethod.GET, null, String.class);
    }

    private FetchException classify(String url, Throwable cause) {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return new FetchTimeoutException(url, props.timeout(), cause);
            }
        }
        return new FetchNetworkException(url, cause);
    }
}
