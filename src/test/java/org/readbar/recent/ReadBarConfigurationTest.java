package org.readbar.recent;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.readbar.recent.scan.RescanScheduler;
import org.readbar.recent.view.RecentViewSync;
import org.readbar.recent.watch.DirectoryChangeFeed;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ReadBarConfigurationTest {

    @TempDir
    Path root;

    private ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
                .withUserConfiguration(PropertiesConfig.class, ReadBarConfiguration.class)
                .withPropertyValues(
                        "app.readbar.roots[0].path=" + root,
                        "app.readbar.roots[0].uses-access-time=true",
                        "app.readbar.extensions=pdf",
                        "app.readbar.max-items=5"
                );
    }

    @Test
    void wiresCoreBeansFromProperties() throws Exception {
        Files.writeString(root.resolve("a.pdf"), "a");

        runner().withPropertyValues("app.readbar.watch-enabled=false").run(context -> {
            assertThat(context).hasSingleBean(RecentSet.class);
            assertThat(context).hasSingleBean(RescanScheduler.class);
            assertThat(context).hasSingleBean(RecentViewSync.class);
            assertThat(context).doesNotHaveBean(DirectoryChangeFeed.class);

            assertThat(context.getBean(RecentSet.class).capacity()).isEqualTo(5);
            WatchedRoots roots = context.getBean(WatchedRoots.class);
            assertThat(roots.list()).containsExactly(new WatchedRoot("root0", root, true));

            assertThat(context.getBean(RescanScheduler.class).rescanAndWait().fedCount()).isEqualTo(1);
        });
    }

    @Test
    void startsChangeFeedByDefault() {
        runner().run(context -> {
            assertThat(context).hasSingleBean(DirectoryChangeFeed.class);
            assertThat(context.getBean(DirectoryChangeFeed.class).isRunning()).isTrue();
        });
    }

    @Test
    void rejectsInvalidCapacity() {
        runner().withPropertyValues("app.readbar.max-items=0").run(context ->
                assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(ReadBarProperties.class)
    static class PropertiesConfig {
    }
}
