package tech.noetzold.guardrail_api.controller;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import tech.noetzold.guardrail_api.service.PolicyLoader;
import tech.noetzold.guardrail_api.service.PolicyStore;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class PolicyControllerTest {

    @TempDir
    Path dir;

    @Test
    void reloadPicksUpNewVersionAndRejectsBrokenFiles() throws Exception {
        Path file = dir.resolve("policy.yml");
        Files.writeString(file, "policy_version: v1\nintents:\n  a: {}\nroles:\n  r: {allow: [a]}\n");
        PolicyStore store = new PolicyStore(new PolicyLoader(), new DefaultResourceLoader(), file.toUri().toString());
        store.init();
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new PolicyController(store))
                .setControllerAdvice(new ErrorHandler())
                .build();

        mvc.perform(get("/policy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.policy_version").value("v1"))
                .andExpect(jsonPath("$.intents[0]").value("a"))
                .andExpect(jsonPath("$.roles[0]").value("r"));

        Files.writeString(file, "policy_version: v2\nintents:\n  a: {}\n  b: {}\nroles:\n  r: {allow: [a, b]}\n");
        mvc.perform(post("/policy/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.policy_version").value("v2"));

        Files.writeString(file, "policy_version: v3\nintents:\n  a: {}\nroles:\n  r: {allow: [missing]}\n");
        mvc.perform(post("/policy/reload"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("POLICY_INVALID"))
                .andExpect(jsonPath("$.message").value(containsString("missing")));

        mvc.perform(get("/policy")).andExpect(jsonPath("$.policy_version").value("v2"));

        Files.writeString(file, "policy_version: v4\nintents:\n  a: {}\nroles:\n  r: {allow: [a, ~]}\n");
        mvc.perform(post("/policy/reload"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("POLICY_INVALID"))
                .andExpect(jsonPath("$.message").value(containsString("Role 'r'")));

        mvc.perform(get("/policy")).andExpect(jsonPath("$.policy_version").value("v2"));
    }
}
