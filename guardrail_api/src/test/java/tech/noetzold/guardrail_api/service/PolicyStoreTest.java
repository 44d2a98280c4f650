package tech.noetzold.guardrail_api.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import tech.noetzold.guardrail_api.model.PolicyDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyStoreTest {

    @TempDir
    Path dir;

    private static String policy(String version) {
        return "policy_version: " + version + "\n"
                + "intents:\n  ask_public_policy: {resources: [public_handbook]}\n"
                + "roles:\n  intern: {allow: [ask_public_policy]}\n";
    }

    private PolicyStore store(Path file) {
        return new PolicyStore(new PolicyLoader(), new DefaultResourceLoader(), file.toUri().toString());
    }

    @Test
    void reloadSwapsInTheNewDocument() throws IOException {
        Path file = dir.resolve("policy.yml");
        Files.writeString(file, policy("v1"));
        PolicyStore store = store(file);
        store.init();
        PolicyDocument captured = store.current();

        Files.writeString(file, policy("v2"));
        PolicyDocument reloaded = store.reload();

        assertThat(reloaded.version()).isEqualTo("v2");
        assertThat(store.current()).isSameAs(reloaded);
        // a reference taken before the reload is untouched
        assertThat(captured.version()).isEqualTo("v1");
    }

    @Test
    void failedReloadKeepsPreviousPolicy() throws IOException {
        Path file = dir.resolve("policy.yml");
        Files.writeString(file, policy("v1"));
        PolicyStore store = store(file);
        store.init();

        Files.writeString(file, "intents:\n  a: {}\nroles:\n  r: {deny: [ghost]}\n");

        assertThatThrownBy(store::reload).isInstanceOf(PolicyConfigurationException.class);
        assertThat(store.current().version()).isEqualTo("v1");
    }

    @Test
    void startupFailsOnInvalidPolicy() throws IOException {
        Path file = dir.resolve("broken.yml");
        Files.writeString(file, "roles:\n  r: {}\n");
        PolicyStore store = store(file);

        assertThatThrownBy(store::init).isInstanceOf(PolicyConfigurationException.class);
        assertThatThrownBy(store::current).isInstanceOf(PolicyConfigurationException.class);
    }
}
