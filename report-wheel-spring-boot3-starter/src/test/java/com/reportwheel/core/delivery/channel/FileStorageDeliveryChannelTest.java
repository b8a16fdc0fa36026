package com.reportwheel.core.delivery.channel;

import com.reportwheel.exception.ChannelConfigException;
import com.reportwheel.model.DeliveryContext;
import com.reportwheel.model.DeliveryReceipt;
import com.reportwheel.model.enums.DeliveryMethodType;
import com.reportwheel.support.ScriptedGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileStorageDeliveryChannelTest {

    private final FileStorageDeliveryChannel channel = new FileStorageDeliveryChannel();

    @TempDir
    Path dir;

    private static DeliveryContext ctx(String executionId) {
        return DeliveryContext.builder()
                .executionId(executionId)
                .scheduleId("s-1")
                .channel(DeliveryMethodType.FILE_STORAGE)
                .attempt(1)
                .budget(3)
                .build();
    }

    private Map<String, Object> config(boolean overwrite) {
        Map<String, Object> config = new HashMap<>();
        config.put("path", dir.resolve("out").toString());
        config.put("overwrite", overwrite);
        return config;
    }

    @Test
    void shouldWriteArtifactIntoDirectory() throws Exception {
        DeliveryReceipt receipt = channel.deliver(config(false), ScriptedGenerator.artifact("rx-1"), ctx("e-1"));

        Path written = dir.resolve("out").resolve("sales.csv");
        assertThat(Files.readString(written, StandardCharsets.UTF_8)).startsWith("region,total");
        assertThat(receipt.getMetadata()).containsEntry("path", written.toAbsolutePath().toString());
        assertThat(receipt.getMetadata().get("bytes")).isEqualTo((long) Files.size(written));
    }

    @Test
    void shouldKeepExistingFileUnlessOverwriteAllowed() throws Exception {
        Path out = Files.createDirectories(dir.resolve("out"));
        Files.writeString(out.resolve("sales.csv"), "previous");

        channel.deliver(config(false), ScriptedGenerator.artifact("rx-2"), ctx("e-2"));

        assertThat(Files.readString(out.resolve("sales.csv"))).isEqualTo("previous");
        assertThat(out.resolve("sales-e-2.csv")).exists();

        channel.deliver(config(true), ScriptedGenerator.artifact("rx-3"), ctx("e-3"));

        assertThat(Files.readString(out.resolve("sales.csv"))).startsWith("region,total");
        assertThat(out.resolve("sales-e-3.csv")).doesNotExist();
    }

    @Test
    void shouldRequirePath() {
        assertThatThrownBy(() -> channel.validate(Map.of("overwrite", true)))
                .isInstanceOf(ChannelConfigException.class)
                .hasMessageContaining("'path' is required");
    }

    @Test
    void shouldSuffixNamesWithoutExtension() {
        assertThat(FileStorageDeliveryChannel.withSuffix("report", "e-1")).isEqualTo("report-e-1");
        assertThat(FileStorageDeliveryChannel.withSuffix("report.tar.gz", "e-1")).isEqualTo("report.tar-e-1.gz");
    }
}
