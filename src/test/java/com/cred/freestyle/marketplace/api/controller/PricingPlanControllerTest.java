package com.cred.freestyle.marketplace.api.controller;

import com.cred.freestyle.marketplace.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.marketplace.domain.model.PricingPlan;
import com.cred.freestyle.marketplace.domain.model.PricingPlan.PlanType;
import com.cred.freestyle.marketplace.exception.ResourceNotFoundException;
import com.cred.freestyle.marketplace.service.PricingPlanService;
import com.cred.freestyle.marketplace.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for PricingPlanController using MockMvc.
 * Role checks are covered by the security filter chain, not here.
 */
@WebMvcTest(PricingPlanController.class)
@AutoConfigureMockMvc(addFilters = false)
@ContextConfiguration(classes = {PricingPlanController.class, GlobalExceptionHandler.class})
@DisplayName("PricingPlanController Tests")
class PricingPlanControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PricingPlanService pricingPlanService;

    @Test
    @DisplayName("GET / - Lists all active plans")
    void listPlans_All_Returns200() throws Exception {
        when(pricingPlanService.listActivePlans(null)).thenReturn(List.of(
                TestDataBuilder.aPlan().build(),
                TestDataBuilder.aPlan().name("VIP Boost").planType(PlanType.AD_BOOST).build()));

        mockMvc.perform(get("/api/v1/payments/plans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].planType").value("subscription"))
                .andExpect(jsonPath("$[0].features", hasSize(2)))
                .andExpect(jsonPath("$[1].planType").value("ad_boost"));
    }

    @Test
    @DisplayName("GET /?plan_type=ad_boost - Filters by plan type")
    void listPlans_Filtered_Returns200() throws Exception {
        when(pricingPlanService.listActivePlans(PlanType.AD_BOOST)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/payments/plans").param("plan_type", "ad_boost"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        verify(pricingPlanService).listActivePlans(PlanType.AD_BOOST);
    }

    @Test
    @DisplayName("GET /?plan_type=lifetime - Unknown plan type returns 400")
    void listPlans_UnknownType_Returns400() throws Exception {
        mockMvc.perform(get("/api/v1/payments/plans").param("plan_type", "lifetime"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(pricingPlanService);
    }

    @Test
    @DisplayName("POST / - Valid plan returns 201")
    void createPlan_Returns201() throws Exception {
        // Given
        when(pricingPlanService.createPlan(any(PricingPlan.class))).thenAnswer(inv -> {
            PricingPlan plan = inv.getArgument(0);
            plan.setPlanId("PLAN-1");
            return plan;
        });

        String body = """
                {
                  "name": "Pro Monthly",
                  "planType": "subscription",
                  "price": 2499.00,
                  "currency": "kes",
                  "durationDays": 30,
                  "features": ["Analytics", "Priority support"]
                }
                """;

        // When / Then
        mockMvc.perform(post("/api/v1/payments/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.planId").value("PLAN-1"))
                .andExpect(jsonPath("$.currency").value("KES"))
                .andExpect(jsonPath("$.isActive").value(true));

        ArgumentCaptor<PricingPlan> captor = ArgumentCaptor.forClass(PricingPlan.class);
        verify(pricingPlanService).createPlan(captor.capture());
        assertThat(captor.getValue().getPlanType()).isEqualTo(PlanType.SUBSCRIPTION);
        assertThat(captor.getValue().getFeatures()).containsExactly("Analytics", "Priority support");
    }

    @Test
    @DisplayName("POST / - Negative price and zero duration return 400 with field errors")
    void createPlan_InvalidFields_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/payments/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Broken", "planType": "subscription", "price": -5, "durationDays": 0}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.price").exists())
                .andExpect(jsonPath("$.details.fieldErrors.durationDays").exists());

        verifyNoInteractions(pricingPlanService);
    }

    @Test
    @DisplayName("PUT /{planId} - Missing plan returns 404")
    void updatePlan_Missing_Returns404() throws Exception {
        when(pricingPlanService.updatePlan(eq("missing"), any(PricingPlan.class)))
                .thenThrow(new ResourceNotFoundException("PricingPlan", "missing"));

        mockMvc.perform(put("/api/v1/payments/plans/{planId}", "missing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Pro", "planType": "subscription", "price": 2499, "durationDays": 30}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.resourceType").value("PricingPlan"));
    }

    @Test
    @DisplayName("DELETE /{planId} - Returns the deactivated plan")
    void deactivatePlan_Returns200() throws Exception {
        PricingPlan plan = TestDataBuilder.aPlan().isActive(false).build();
        when(pricingPlanService.deactivatePlan(plan.getPlanId())).thenReturn(plan);

        mockMvc.perform(delete("/api/v1/payments/plans/{planId}", plan.getPlanId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isActive").value(false));
    }
}
