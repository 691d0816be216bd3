/**
 * AnalysisResult.java
 *
 * 崩溃分析服务的回复。分析服务不可用时返回 {@link #unavailable()}。
 */
package club.ppmc.debugger.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisResult(
        @JsonProperty("explanation") String explanation,
        @JsonProperty("suggested_fix") String suggestedFix,
        @JsonProperty("related_code") List<String> relatedCode) {

    public static final String UNAVAILABLE = "Analysis unavailable";

    public AnalysisResult {
        relatedCode = relatedCode == null ? List.of() : List.copyOf(relatedCode);
    }

    public static AnalysisResult unavailable() {
        return new AnalysisResult(UNAVAILABLE, "", List.of());
    }
}
