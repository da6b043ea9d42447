package ge.salesinsight.common.dto.cohort;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Active and inactive customers of one calendar quarter.
 * Inactive customers transacted in an earlier quarter but not in this one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuarterlyActivityDto {

    private String quarter;

    @JsonProperty("active_customers")
    private List<String> activeCustomers;

    @JsonProperty("inactive_customers")
    private List<String> inactiveCustomers;
}
