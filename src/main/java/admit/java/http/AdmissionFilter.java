package admit.java.http;

import admit.java.gate.Admission;
import admit.java.gate.AdmissionGate;
import admit.java.gate.Caller;
import admit.java.registry.AdmissionPolicy;
import admit.java.response.RateLimitResponses;
import admit.java.response.RejectionBody;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Servlet filter that admits or throttles requests for one endpoint group.
 *
 * <p>Denied requests get a 429 with {@code Retry-After} and the standard JSON body; the
 * rest of the chain is not invoked. Admitted requests run the chain inside the admission,
 * so a held concurrency slot is released however the chain exits. When the chain starts
 * async processing the slot stays held until the async request completes, times out or fails.
 */
public final class AdmissionFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(AdmissionFilter.class);

    private final AdmissionGate gate;
    private final AdmissionPolicy policy;
    private final HttpCallerResolver callerResolver;

    public AdmissionFilter(AdmissionGate gate, AdmissionPolicy policy, HttpCallerResolver callerResolver) {
        if (gate == null) {
            throw new IllegalArgumentException("gate cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (callerResolver == null) {
            throw new IllegalArgumentException("callerResolver cannot be null");
        }
        this.gate = gate;
        this.policy = policy;
        this.callerResolver = callerResolver;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
        throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest httpRequest)
            || !(response instanceof HttpServletResponse httpResponse)) {
            chain.doFilter(request, response);
            return;
        }

        String clientIp = ClientIps.resolve(httpRequest);
        Caller caller = callerResolver.resolve(httpRequest, clientIp);

        Admission admission = gate.tryAdmit(policy, caller);
        if (!admission.allowed()) {
            writeRejection(httpResponse, admission.rejection());
            return;
        }

        boolean handedOff = false;
        try {
            chain.doFilter(request, response);
            if (httpRequest.isAsyncStarted()) {
                httpRequest.getAsyncContext().addListener(new ReleasingAsyncListener(admission));
                handedOff = true;
            }
        } finally {
            if (!handedOff) {
                admission.close();
            }
        }
    }

    private void writeRejection(HttpServletResponse response, RejectionBody body) throws IOException {
        log.debug("Throttled {} request, retry after {}s", policy.name(), body.retryAfterSeconds());
        response.setStatus(RateLimitResponses.STATUS_TOO_MANY_REQUESTS);
        response.setHeader(RateLimitResponses.RETRY_AFTER_HEADER, String.valueOf(body.retryAfterSeconds()));
        response.setContentType(RateLimitResponses.CONTENT_TYPE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(RateLimitResponses.toJson(body));
    }

    /**
     * Holds the admission across an async request and releases it when the request ends.
     */
    private static final class ReleasingAsyncListener implements AsyncListener {

        private final Admission admission;

        private ReleasingAsyncListener(Admission admission) {
            this.admission = admission;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            admission.close();
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            admission.close();
        }

        @Override
        public void onError(AsyncEvent event) {
            admission.close();
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            // Listeners do not carry over to a new async cycle.
            event.getAsyncContext().addListener(this);
        }
    }
}
