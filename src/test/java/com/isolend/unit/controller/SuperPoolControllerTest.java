package com.isolend.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.isolend.api.controller.SuperPoolController;
import com.isolend.config.ApiResponseAdvice;
import com.isolend.core.math.WadMath;
import com.isolend.exception.GlobalExceptionHandler;
import com.isolend.exception.ResourceNotFoundException;
import com.isolend.superpool.SuperPool;
import com.isolend.superpool.SuperPoolFactory;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the SuperPoolController.
 */
@ExtendWith(MockitoExtension.class)
class SuperPoolControllerTest {

    private static final String ADDRESS = "0x2222222222222222222222222222222222222222";

    private MockMvc mockMvc;

    @Mock
    private SuperPoolFactory superPoolFactory;

    @Mock
    private SuperPool superPool;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SuperPoolController(superPoolFactory))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("GET /api/superpools lists deployed addresses")
    void listSuperPools() throws Exception {
        when(superPoolFactory.getSuperPools()).thenReturn(List.of(ADDRESS));

        mockMvc.perform(get("/api/superpools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0]").value(ADDRESS));
    }

    @Test
    @DisplayName("GET /api/superpools/{address} returns totals, share price and queues")
    void getSuperPool() throws Exception {
        when(superPoolFactory.require(ADDRESS)).thenReturn(superPool);
        when(superPool.getAddress()).thenReturn(ADDRESS);
        when(superPool.getName()).thenReturn("isoUSDC");
        when(superPool.getSymbol()).thenReturn("isoUSDC");
        when(superPool.getFee()).thenReturn(WadMath.wad("0.1"));
        when(superPool.totalAssets()).thenReturn(BigInteger.valueOf(6_000));
        when(superPool.totalSupply()).thenReturn(BigInteger.valueOf(5_000));
        when(superPool.convertToAssets(WadMath.WAD)).thenReturn(WadMath.wad("1.2"));
        when(superPool.getDepositQueue()).thenReturn(List.of("0xpool-a", "0xpool-b"));
        when(superPool.getWithdrawQueue()).thenReturn(List.of("0xpool-b", "0xpool-a"));

        mockMvc.perform(get("/api/superpools/" + ADDRESS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("isoUSDC"))
                .andExpect(jsonPath("$.data.totalAssets").value(6_000))
                .andExpect(jsonPath("$.data.sharePrice").value(1_200_000_000_000_000_000L))
                .andExpect(jsonPath("$.data.depositQueue[1]").value("0xpool-b"))
                .andExpect(jsonPath("$.data.withdrawQueue[0]").value("0xpool-b"));
    }

    @Test
    @DisplayName("Unknown superpool maps to 404")
    void unknownSuperPool() throws Exception {
        when(superPoolFactory.require(ADDRESS)).thenThrow(new ResourceNotFoundException("SuperPool", ADDRESS));

        mockMvc.perform(get("/api/superpools/" + ADDRESS))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }
}
