package com.rfid.positioning.repository;

import com.rfid.positioning.dto.Antenna;
import com.rfid.positioning.dto.Coordinates;
import com.rfid.positioning.dto.Reading;
import com.rfid.positioning.dto.Tag;
import com.rfid.positioning.dto.TagRole;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Repository;

/**
 * In-memory implementation of the ReadingStore interface.
 * Serves as the default store and as a transient snapshot for ad-hoc evaluation requests.
 * Antennas and tags are keyed by id, so saving an existing id replaces it.
 */
@Repository
public class InMemoryReadingStore implements ReadingStore {

    private final Map<String, Antenna> antennas = new ConcurrentHashMap<>();
    private final Map<String, Tag> tags = new ConcurrentHashMap<>();
    private final List<Reading> readings = new CopyOnWriteArrayList<>();

    public static InMemoryReadingStore of(
            Collection<Antenna> antennas, Collection<Tag> tags, Collection<Reading> readings) {
        InMemoryReadingStore store = new InMemoryReadingStore();
        antennas.forEach(store::saveAntenna);
        tags.forEach(store::saveTag);
        store.appendReadings(readings);
        return store;
    }

    public void saveAntenna(Antenna antenna) {
        antennas.put(antenna.antennaId(), antenna);
    }

    /**
     * Saves a tag. The observed flag is kept once readings exist for the tag, and a target's stored
     * prediction is kept unless the saved tag carries its own.
     */
    public void saveTag(Tag tag) {
        tags.compute(tag.tagId(), (id, existing) -> {
            Tag saved = tag;
            boolean observed = (existing != null && existing.observed()) || hasReadings(id);
            if (observed && !saved.observed()) {
                saved = saved.withObserved(true);
            }
            if (existing != null && !saved.isReference() && saved.predictedCoordinates() == null) {
                saved = saved.withPredictedCoordinates(existing.predictedCoordinates());
            }
            return saved;
        });
    }

    private boolean hasReadings(String tagId) {
        return readings.stream().anyMatch(reading -> reading.tagId().equals(tagId));
    }

    public void appendReading(Reading reading) {
        readings.add(reading);
        tags.computeIfPresent(reading.tagId(), (id, tag) -> tag.withObserved(true));
    }

    public void appendReadings(Collection<Reading> batch) {
        batch.forEach(this::appendReading);
    }

    @Override
    public List<Reading> listReadings() {
        return List.copyOf(readings);
    }

    @Override
    public List<Tag> listTags(TagRole roleFilter) {
        List<Tag> result = new ArrayList<>();
        for (Tag tag : tags.values()) {
            if (roleFilter == null || tag.role() == roleFilter) {
                result.add(tag);
            }
        }
        return result;
    }

    @Override
    public List<Antenna> listAntennas() {
        return List.copyOf(antennas.values());
    }

    @Override
    public void savePredictedPosition(String tagId, Coordinates predicted) {
        tags.compute(tagId, (id, tag) -> {
            if (tag == null) {
                throw new IllegalArgumentException("Unknown tag: " + tagId);
            }
            if (tag.isReference()) {
                throw new IllegalArgumentException(
                        "Reference tag " + tagId + " cannot receive predicted coordinates");
            }
            return tag.withPredictedCoordinates(predicted);
        });
    }

    public void clear() {
        readings.clear();
        tags.clear();
        antennas.clear();
    }
}
