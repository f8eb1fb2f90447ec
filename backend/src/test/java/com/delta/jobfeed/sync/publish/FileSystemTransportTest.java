package com.delta.jobfeed.sync.publish;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileSystemTransportTest {

    @TempDir
    Path tempDir;

    @Test
    void copiesFeedIntoTargetDirectory() throws Exception {
        Path target = tempDir.resolve("upload");
        FileSystemTransport transport = new FileSystemTransport(target, "myticas-jobs.xml");

        boolean published = transport.publish("<source/>".getBytes(StandardCharsets.UTF_8));

        assertThat(published).isTrue();
        assertThat(Files.readString(target.resolve("myticas-jobs.xml"))).isEqualTo("<source/>");
        assertThat(Files.exists(target.resolve("myticas-jobs.xml.uploading"))).isFalse();
    }

    @Test
    void reportsFailureWithoutTarget() {
        FileSystemTransport transport = new FileSystemTransport(null, "myticas-jobs.xml");

        assertThat(transport.publish(new byte[0])).isFalse();
    }

    @Test
    void reportsFailureWhenTargetIsAFile() throws Exception {
        Path blocked = Files.writeString(tempDir.resolve("blocked"), "not a directory");
        FileSystemTransport transport = new FileSystemTransport(blocked, "myticas-jobs.xml");

        assertThat(transport.publish(new byte[] {1, 2, 3})).isFalse();
    }
}
