package com.xammer.spectre.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public access block flags of a bucket. The bucket counts as public as soon as one flag is off.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PublicAccessState {
    @JsonProperty("is_public")
    private boolean publiclyAccessible;
    private boolean blockPublicAcls;
    private boolean ignorePublicAcls;
    private boolean blockPublicPolicy;
    private boolean restrictPublicBuckets;

    public static PublicAccessState fromFlags(boolean blockPublicAcls, boolean ignorePublicAcls,
                                              boolean blockPublicPolicy, boolean restrictPublicBuckets) {
        boolean open = !blockPublicAcls || !ignorePublicAcls || !blockPublicPolicy || !restrictPublicBuckets;
        return new PublicAccessState(open, blockPublicAcls, ignorePublicAcls, blockPublicPolicy, restrictPublicBuckets);
    }
}
