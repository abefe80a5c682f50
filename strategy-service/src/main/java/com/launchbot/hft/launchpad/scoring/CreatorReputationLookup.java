package com.launchbot.hft.launchpad.scoring;

import java.util.OptionalDouble;

/**
 * Source of a creator's track record, normalized to [0, 10].
 */
public interface CreatorReputationLookup {

    /**
     * @return empty when the creator is unknown
     * @throws DataQualityException when the lookup itself failed
     */
    OptionalDouble reputation(String creator) throws DataQualityException;
}
