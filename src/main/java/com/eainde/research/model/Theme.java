package com.eainde.research.model;

import java.io.Serializable;
import java.util.List;

/**
 * A cross-subtopic group of related claims.
 *
 * @param title           derived title
 * @param claims          member claims, strongest first
 * @param highCount       number of high-confidence members
 * @param mediumCount     number of medium-confidence members
 * @param lowCount        number of low-confidence members
 * @param distinctSources distinct source URLs cited by the members
 * @param firstClaimIndex earliest aggregation index among the members
 */
public record Theme(
        String title,
        List<Claim> claims,
        int highCount,
        int mediumCount,
        int lowCount,
        int distinctSources,
        int firstClaimIndex
) implements Serializable {

    public Theme {
        claims = List.copyOf(claims);
    }
}
