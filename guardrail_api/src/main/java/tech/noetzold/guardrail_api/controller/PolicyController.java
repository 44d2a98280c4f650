package tech.noetzold.guardrail_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.guardrail_api.model.PolicySummary;
import tech.noetzold.guardrail_api.service.PolicyStore;

@RestController
@RequestMapping("/policy")
@RequiredArgsConstructor
@Tag(name = "Policy")
public class PolicyController {

    private final PolicyStore policyStore;

    @GetMapping
    public PolicySummary current() {
        return PolicySummary.of(policyStore.current());
    }

    @PostMapping("/reload")
    public PolicySummary reload() {
        return PolicySummary.of(policyStore.reload());
    }
}
