package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import switchkeeper.engine.model.Site;

/**
 * Response DTO for a controller site.
 * GET /api/v1/sites
 */
public record SiteResponse(
        @JsonProperty("name") String name,
        @JsonProperty("desc") String desc,
        @JsonProperty("displayName") String displayName) {

    public static SiteResponse from(Site site) {
        return new SiteResponse(site.name(), site.desc() != null ? site.desc() : "", site.displayName());
    }
}
