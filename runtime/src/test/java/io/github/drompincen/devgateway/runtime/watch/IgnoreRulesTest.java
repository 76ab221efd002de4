package io.github.drompincen.devgateway.runtime.watch;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IgnoreRulesTest {

    private final IgnoreRules rules = IgnoreRules.defaults();

    @Test
    void ignoresBuildAndVcsDirectoriesAtAnyDepth() {
        assertThat(rules.isIgnored(Path.of("node_modules/react/index.js"))).isTrue();
        assertThat(rules.isIgnored(Path.of("packages/app/dist/bundle.js"))).isTrue();
        assertThat(rules.isIgnored(Path.of(".git/HEAD"))).isTrue();
        assertThat(rules.isIgnored(Path.of("service/target/classes"))).isTrue();
    }

    @Test
    void ignoresDotfilesAndLogs() {
        assertThat(rules.isIgnored(Path.of(".env"))).isTrue();
        assertThat(rules.isIgnored(Path.of("src/.cache/x"))).isTrue();
        assertThat(rules.isIgnored(Path.of("logs/server.log"))).isTrue();
    }

    @Test
    void keepsOrdinarySources() {
        assertThat(rules.isIgnored(Path.of("src/main/App.java"))).isFalse();
        assertThat(rules.isIgnored(Path.of("README.md"))).isFalse();
        assertThat(rules.isIgnored(Path.of("builder/Tool.java"))).isFalse();
    }

    @Test
    void customNamesReplaceTheDefaults() {
        IgnoreRules custom = new IgnoreRules(List.of("vendor"));

        assertThat(custom.isIgnored(Path.of("vendor/lib.go"))).isTrue();
        assertThat(custom.isIgnored(Path.of("node_modules/x.js"))).isFalse();
    }
}
