package com.codev.tunnel;

import com.codev.tunnel.support.TestWait;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MetadataPublisherTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void endpointIsResolvedAgainstServerUrl() {
        assertEquals("https://cloud.codevos.ai/api/tower/metadata",
                new MetadataPublisher("https://cloud.codevos.ai", "k", mapper).getEndpoint().toString());
        assertEquals("https://cloud.codevos.ai/api/tower/metadata",
                new MetadataPublisher("https://cloud.codevos.ai/app/", "k", mapper).getEndpoint().toString());
    }

    @Test
    void unreachableServerCompletesWithMinusOne() throws Exception {
        MetadataPublisher publisher = new MetadataPublisher(
                "http://127.0.0.1:" + TestWait.unusedPort(), "ctk_test_key", mapper);
        TowerMetadata snapshot = new TowerMetadata(
                List.of(new TowerMetadata.Project("/work/a", "a")), List.of());

        int status = publisher.publish(snapshot).get(15, TimeUnit.SECONDS);

        assertEquals(-1, status);
    }
}
