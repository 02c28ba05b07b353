package com.isolend.api.controller;

import com.isolend.api.dto.response.SuperPoolResponse;
import com.isolend.core.math.WadMath;
import com.isolend.superpool.SuperPool;
import com.isolend.superpool.SuperPoolFactory;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only superpool views.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/superpools -- addresses of all deployed superpools</li>
 *   <li>GET /api/superpools/{address} -- totals, share price, fee and queues</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/superpools")
public class SuperPoolController {

    private final SuperPoolFactory superPoolFactory;

    public SuperPoolController(SuperPoolFactory superPoolFactory) {
        this.superPoolFactory = superPoolFactory;
    }

    @GetMapping
    public ResponseEntity<List<String>> listSuperPools() {
        return ResponseEntity.ok(superPoolFactory.getSuperPools());
    }

    @GetMapping("/{address}")
    public ResponseEntity<SuperPoolResponse> getSuperPool(@PathVariable String address) {
        SuperPool superPool = superPoolFactory.require(address);
        return ResponseEntity.ok(SuperPoolResponse.builder()
                .address(superPool.getAddress())
                .name(superPool.getName())
                .symbol(superPool.getSymbol())
                .asset(superPool.getAsset())
                .owner(superPool.getOwner())
                .feeRecipient(superPool.getFeeRecipient())
                .fee(superPool.getFee())
                .superPoolCap(superPool.getSuperPoolCap())
                .totalAssets(superPool.totalAssets())
                .totalSupply(superPool.totalSupply())
                .sharePrice(superPool.convertToAssets(WadMath.WAD))
                .paused(superPool.isPaused())
                .depositQueue(superPool.getDepositQueue())
                .withdrawQueue(superPool.getWithdrawQueue())
                .build());
    }
}
