package com.isolend.unit.controller;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.isolend.api.controller.PoolController;
import com.isolend.config.ApiResponseAdvice;
import com.isolend.exception.GlobalExceptionHandler;
import com.isolend.exception.ResourceNotFoundException;
import com.isolend.pool.AccrualResult;
import com.isolend.pool.PoolData;
import com.isolend.pool.PoolService;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the PoolController.
 */
@ExtendWith(MockitoExtension.class)
class PoolControllerTest {

    private static final String POOL_ID = "0x" + "ab".repeat(32);
    private static final String OWNER = "0x00000000000000000000000000000000000A11CE";

    private MockMvc mockMvc;

    @Mock
    private PoolService poolService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PoolController(poolService))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private PoolData pool() {
        return PoolData.builder()
                .poolId(POOL_ID)
                .owner(OWNER.toLowerCase())
                .asset("0x00000000000000000000000000000000000000c1")
                .rateModelKey("fixed-10")
                .depositCap(BigInteger.valueOf(1_000_000))
                .borrowCap(BigInteger.valueOf(500_000))
                .interestFee(BigInteger.ZERO)
                .originationFee(BigInteger.ZERO)
                .lastUpdated(1_767_225_600L)
                .totalDepositAssets(BigInteger.valueOf(15_000))
                .totalDepositShares(BigInteger.valueOf(10_000))
                .totalBorrowAssets(BigInteger.valueOf(10_000))
                .totalBorrowShares(BigInteger.valueOf(5_000))
                .build();
    }

    @Test
    @DisplayName("GET /api/pools/{poolId} returns the pool snapshot in the envelope")
    void getPoolReturnsSnapshot() throws Exception {
        when(poolService.getPoolData(POOL_ID)).thenReturn(pool());

        mockMvc.perform(get("/api/pools/" + POOL_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.rateModelKey").value("fixed-10"))
                .andExpect(jsonPath("$.data.totalDepositAssets").value(15_000))
                .andExpect(jsonPath("$.data.idleLiquidity").value(5_000))
                .andExpect(jsonPath("$.data.paused").value(false));
    }

    @Test
    @DisplayName("GET /api/pools/{poolId}/assets/{owner} normalizes the owner address")
    void getAssetsOfNormalizesOwner() throws Exception {
        String normalized = OWNER.toLowerCase();
        when(poolService.balanceOf(normalized, POOL_ID)).thenReturn(BigInteger.valueOf(100));
        when(poolService.getAssetsOf(POOL_ID, normalized)).thenReturn(BigInteger.valueOf(150));

        mockMvc.perform(get("/api/pools/" + POOL_ID + "/assets/" + OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.owner").value(normalized))
                .andExpect(jsonPath("$.data.shares").value(100))
                .andExpect(jsonPath("$.data.assets").value(150));
    }

    @Test
    @DisplayName("Malformed address is a bad request")
    void malformedAddressRejected() throws Exception {
        mockMvc.perform(get("/api/pools/" + POOL_ID + "/borrows/not-an-address"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));

        verify(poolService, never()).getBorrowsOf(anyString(), anyString());
    }

    @Test
    @DisplayName("Unknown pool maps to 404")
    void unknownPoolNotFound() throws Exception {
        when(poolService.getPoolData(POOL_ID)).thenThrow(new ResourceNotFoundException("Pool", POOL_ID));

        mockMvc.perform(get("/api/pools/" + POOL_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.path").value("/api/pools/" + POOL_ID));
    }

    @Test
    @DisplayName("POST /api/pools/{poolId}/accrue reports the accrued interest")
    void accrueReportsInterest() throws Exception {
        when(poolService.accrue(POOL_ID))
                .thenReturn(new AccrualResult(pool(), BigInteger.valueOf(5_000), BigInteger.valueOf(500)));

        mockMvc.perform(post("/api/pools/" + POOL_ID + "/accrue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.interest").value(5_000))
                .andExpect(jsonPath("$.data.feeShares").value(500))
                .andExpect(jsonPath("$.data.lastUpdated").value(1_767_225_600));
    }
}
