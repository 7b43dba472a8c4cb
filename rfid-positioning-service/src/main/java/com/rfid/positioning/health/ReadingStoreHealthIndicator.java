package com.rfid.positioning.health;

import com.rfid.positioning.dto.Tag;
import com.rfid.positioning.repository.ReadingStore;
import java.util.List;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the reading store.
 *
 * Reports UP with the current antenna, tag and reading counts when the store answers, and DOWN
 * with the failure when any listing throws. A store without reference tags is reported UP, since
 * the service itself is healthy; the {@code trainable} detail tells whether a pipeline run can fit
 * its models.
 */
@Component("readingStore")
public class ReadingStoreHealthIndicator implements HealthIndicator {

    private static final String ANTENNAS_KEY = "antennas";
    private static final String REFERENCE_TAGS_KEY = "referenceTags";
    private static final String TARGET_TAGS_KEY = "targetTags";
    private static final String READINGS_KEY = "readings";
    private static final String TRAINABLE_KEY = "trainable";

    private final ReadingStore readingStore;

    public ReadingStoreHealthIndicator(ReadingStore readingStore) {
        this.readingStore = readingStore;
    }

    @Override
    public Health health() {
        try {
            List<Tag> tags = readingStore.listTags();
            long referenceTags = tags.stream().filter(Tag::isReference).count();
            int readings = readingStore.listReadings().size();
            return Health.up()
                    .withDetail(ANTENNAS_KEY, readingStore.listAntennas().size())
                    .withDetail(REFERENCE_TAGS_KEY, referenceTags)
                    .withDetail(TARGET_TAGS_KEY, tags.size() - referenceTags)
                    .withDetail(READINGS_KEY, readings)
                    .withDetail(TRAINABLE_KEY, referenceTags > 0 && readings > 0)
                    .build();
        } catch (Exception e) {
            return Health.down(e).build();
        }
    }
}
