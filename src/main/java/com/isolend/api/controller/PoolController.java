package com.isolend.api.controller;

import com.isolend.core.address.AddressUtil;
import com.isolend.pool.AccrualResult;
import com.isolend.pool.PoolData;
import com.isolend.pool.PoolService;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to the pool ledgers, plus a permissionless accrual trigger.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/pools/{poolId} -- totals, caps, fees and rate model of a pool</li>
 *   <li>GET /api/pools/{poolId}/assets/{owner} -- deposit value of an account</li>
 *   <li>GET /api/pools/{poolId}/borrows/{position} -- debt of a position</li>
 *   <li>POST /api/pools/{poolId}/accrue -- accrue interest up to now</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/pools")
public class PoolController {

    private static final Logger log = LoggerFactory.getLogger(PoolController.class);

    private final PoolService poolService;

    public PoolController(PoolService poolService) {
        this.poolService = poolService;
    }

    @GetMapping("/{poolId}")
    public ResponseEntity<PoolData> getPool(@PathVariable String poolId) {
        return ResponseEntity.ok(poolService.getPoolData(poolId));
    }

    /** Includes interest not yet accrued. */
    @GetMapping("/{poolId}/assets/{owner}")
    public ResponseEntity<Map<String, Object>> getAssetsOf(@PathVariable String poolId, @PathVariable String owner) {
        String account = AddressUtil.normalize(owner);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("poolId", poolId);
        body.put("owner", account);
        body.put("shares", poolService.balanceOf(account, poolId));
        body.put("assets", poolService.getAssetsOf(poolId, account));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{poolId}/borrows/{position}")
    public ResponseEntity<Map<String, Object>> getBorrowsOf(
            @PathVariable String poolId, @PathVariable String position) {
        String account = AddressUtil.normalize(position);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("poolId", poolId);
        body.put("position", account);
        body.put("borrowShares", poolService.getBorrowSharesOf(poolId, account));
        body.put("borrows", poolService.getBorrowsOf(poolId, account));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{poolId}/accrue")
    public ResponseEntity<Map<String, Object>> accrue(@PathVariable String poolId) {
        AccrualResult result = poolService.accrue(poolId);
        log.info("Accrual triggered via API for pool {}: interest={}", poolId, result.interest());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("poolId", poolId);
        body.put("interest", result.interest());
        body.put("feeShares", result.feeShares());
        body.put("lastUpdated", result.pool().getLastUpdated());
        return ResponseEntity.ok(body);
    }
}
