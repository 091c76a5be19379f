package io.avalonrest.example;

import io.avalonrest.server.spi.VerifiedIdentity;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class StaticTokenVerifierTest {

    @Test
    void readsTokenTable() {
        Properties props = new Properties();
        props.setProperty("auth.token.abc", "alice:Admin, User");
        props.setProperty("auth.token.xyz", "bob");
        props.setProperty("server.port", "8080");

        StaticTokenVerifier verifier = StaticTokenVerifier.fromProperties(props);

        assertThat(verifier.size()).isEqualTo(2);
        VerifiedIdentity alice = verifier.verify("abc").orElseThrow();
        assertThat(alice.name()).isEqualTo("alice");
        assertThat(alice.roles()).containsExactlyInAnyOrder("Admin", "User");
        assertThat(verifier.verify("xyz").orElseThrow().roles()).isEmpty();
        assertThat(verifier.verify("nope")).isEmpty();
    }

    @Test
    void safeNamesStayInsideTheStore() {
        assertThat(FileStore.safeName("../../etc/passwd")).isEqualTo("passwd");
        assertThat(FileStore.safeName("C:\\Users\\me\\My Report.PDF")).isEqualTo("my_report.pdf");
        assertThat(FileStore.safeName("..hidden")).isEqualTo("hidden");
    }
}
