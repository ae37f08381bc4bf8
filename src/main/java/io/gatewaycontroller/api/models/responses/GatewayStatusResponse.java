package io.gatewaycontroller.api.models.responses;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.gatewaycontroller.enums.ControllerState;
import io.gatewaycontroller.table.StatusSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Current reachability table as seen by this controller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GatewayStatusResponse {
    private long version;
    private ControllerState controllerState;
    private List<String> reachableClusters;

    public static GatewayStatusResponse from(StatusSnapshot snapshot, ControllerState state) {
        List<String> reachable = snapshot.getClusters().entrySet().stream()
            .filter(Map.Entry::getValue)
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
        return GatewayStatusResponse.builder()
            .version(snapshot.getVersion())
            .controllerState(state)
            .reachableClusters(reachable)
            .build();
    }
}
