package com.rfid.positioning.repository;

import com.rfid.positioning.dto.Antenna;
import com.rfid.positioning.dto.Coordinates;
import com.rfid.positioning.dto.Reading;
import com.rfid.positioning.dto.Tag;
import com.rfid.positioning.dto.TagRole;
import java.util.List;

/**
 * Store holding antennas, tags and raw readings. The positioning pipeline reads a snapshot through
 * this interface and writes predicted target positions back through it; persistence and
 * transactions belong to the implementation.
 */
public interface ReadingStore {

    /**
     * All raw readings, in no particular order.
     *
     * @return list of readings, empty if none were recorded
     */
    List<Reading> listReadings();

    /**
     * Tags, optionally restricted to one role.
     *
     * @param roleFilter role to keep, or null for every tag
     * @return matching tags
     */
    List<Tag> listTags(TagRole roleFilter);

    default List<Tag> listTags() {
        return listTags(null);
    }

    /**
     * Registered antennas. Used only to enumerate the antenna axis.
     *
     * @return list of antennas
     */
    List<Antenna> listAntennas();

    /**
     * Records the predicted position of a target tag.
     *
     * @param tagId target tag id
     * @param predicted predicted coordinates
     * @throws IllegalArgumentException if the tag is unknown or is a reference tag
     */
    void savePredictedPosition(String tagId, Coordinates predicted);
}
