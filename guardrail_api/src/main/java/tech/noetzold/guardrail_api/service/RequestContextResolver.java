package tech.noetzold.guardrail_api.service;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import tech.noetzold.guardrail_api.model.RequestContext;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the {@link RequestContext} from identity headers set by the upstream gateway.
 * Missing or blank headers are dropped; there is no default role.
 */
@Component
public class RequestContextResolver {

    public static final String ROLE_HEADER = "x-user-role";
    public static final String REQUEST_ID_HEADER = "x-request-id";

    private static final Map<String, String> ATTRIBUTE_HEADERS = new LinkedHashMap<>();

    static {
        ATTRIBUTE_HEADERS.put("org_unit", "x-user-orgunit");
        ATTRIBUTE_HEADERS.put("geo", "x-user-geo");
        ATTRIBUTE_HEADERS.put("ticket_id", "x-ticket-id");
        ATTRIBUTE_HEADERS.put("justification", "x-justification");
    }

    public RequestContext resolve(HttpServletRequest request) {
        Map<String, String> attrs = new LinkedHashMap<>();
        ATTRIBUTE_HEADERS.forEach((key, header) -> {
            String v = trimToNull(request.getHeader(header));
            if (v != null) attrs.put(key, v);
        });
        return new RequestContext(trimToNull(request.getHeader(ROLE_HEADER)), attrs);
    }

    public String resolveRequestId(HttpServletRequest request) {
        String rid = trimToNull(request.getHeader(REQUEST_ID_HEADER));
        if (rid != null) return rid;
        return "req_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    private String trimToNull(String v) {
        if (v == null) return null;
        String t = v.trim();
        return t.isEmpty() ? null : t;
    }
}
