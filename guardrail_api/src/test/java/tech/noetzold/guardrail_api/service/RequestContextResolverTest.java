package tech.noetzold.guardrail_api.service;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import tech.noetzold.guardrail_api.model.RequestContext;

import static org.assertj.core.api.Assertions.assertThat;

class RequestContextResolverTest {

    private final RequestContextResolver resolver = new RequestContextResolver();

    @Test
    void mapsIdentityHeadersToAttributes() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.addHeader("x-user-role", "hr_manager");
        req.addHeader("x-user-orgunit", "HR");
        req.addHeader("x-user-geo", "IN");
        req.addHeader("x-ticket-id", "INC-1");
        req.addHeader("x-justification", "quarter close");

        RequestContext ctx = resolver.resolve(req);

        assertThat(ctx.role()).isEqualTo("hr_manager");
        assertThat(ctx.attributes())
                .containsEntry("org_unit", "HR")
                .containsEntry("geo", "IN")
                .containsEntry("ticket_id", "INC-1")
                .containsEntry("justification", "quarter close");
    }

    @Test
    void blankHeadersAreAbsentAndThereIsNoDefaultRole() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.addHeader("x-user-orgunit", "  ");

        RequestContext ctx = resolver.resolve(req);

        assertThat(ctx.role()).isNull();
        assertThat(ctx.attributes()).isEmpty();
        assertThat(ctx.hasAttribute("org_unit")).isFalse();
    }

    @Test
    void requestIdComesFromHeaderOrIsGenerated() {
        MockHttpServletRequest withId = new MockHttpServletRequest();
        withId.addHeader("x-request-id", "abc-123");

        assertThat(resolver.resolveRequestId(withId)).isEqualTo("abc-123");
        assertThat(resolver.resolveRequestId(new MockHttpServletRequest())).matches("req_\\d+_[0-9a-f]{8}");
    }
}
