package com.isolend.api.controller;

import com.isolend.api.dto.response.PositionHealthResponse;
import com.isolend.core.address.AddressUtil;
import com.isolend.exception.ResourceNotFoundException;
import com.isolend.position.PositionManager;
import com.isolend.risk.RiskData;
import com.isolend.risk.RiskModule;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only views of positions for liquidation bots and dashboards.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/positions/{position}/risk -- asset value, debt value, required collateral</li>
 *   <li>GET /api/positions/{position}/health -- health flag and health factor</li>
 *   <li>GET /api/positions/{position}/owner -- current owner</li>
 *   <li>GET /api/positions/{position}/auth/{address} -- whether address may act on the position</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private final RiskModule riskModule;
    private final PositionManager positionManager;

    public PositionController(RiskModule riskModule, PositionManager positionManager) {
        this.riskModule = riskModule;
        this.positionManager = positionManager;
    }

    @GetMapping("/{position}/risk")
    public ResponseEntity<RiskData> getRiskData(@PathVariable String position) {
        return ResponseEntity.ok(riskModule.getRiskData(position));
    }

    @GetMapping("/{position}/health")
    public ResponseEntity<PositionHealthResponse> getHealth(@PathVariable String position) {
        String account = AddressUtil.normalize(position);
        return ResponseEntity.ok(PositionHealthResponse.builder()
                .position(account)
                .healthy(riskModule.isPositionHealthy(account))
                .healthFactor(riskModule.healthFactor(account))
                .build());
    }

    @GetMapping("/{position}/owner")
    public ResponseEntity<Map<String, String>> getOwner(@PathVariable String position) {
        String owner = positionManager.ownerOf(position);
        if (owner == null) {
            throw new ResourceNotFoundException("Position", position);
        }
        return ResponseEntity.ok(Map.of("position", AddressUtil.normalize(position), "owner", owner));
    }

    @GetMapping("/{position}/auth/{address}")
    public ResponseEntity<Map<String, Object>> isAuth(@PathVariable String position, @PathVariable String address) {
        return ResponseEntity.ok(Map.of(
                "position", AddressUtil.normalize(position),
                "address", AddressUtil.normalize(address),
                "authorized", positionManager.isAuth(position, address)));
    }
}
