package com.gocomet.ridebooking.config;

import com.gocomet.ridebooking.common.dto.ApiResponse;
import com.gocomet.ridebooking.fare.model.RideCategory;
import com.gocomet.ridebooking.ride.model.PaymentMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/config")
public class ConfigController {

    /**
     * GET /v1/config/ride-categories — Supported ride categories and their fare multipliers.
     */
    @GetMapping("/ride-categories")
    public ResponseEntity<ApiResponse<Map<String, BigDecimal>>> getRideCategories() {
        Map<String, BigDecimal> categories = new LinkedHashMap<>();
        for (RideCategory category : RideCategory.values()) {
            categories.put(category.getValue(), category.getMultiplier());
        }
        return ResponseEntity.ok(ApiResponse.ok("Ride categories retrieved successfully", categories));
    }

    /**
     * GET /v1/config/payment-methods — List supported payment methods.
     */
    @GetMapping("/payment-methods")
    public ResponseEntity<ApiResponse<List<String>>> getPaymentMethods() {
        List<String> methods = Arrays.stream(PaymentMethod.values())
                .map(PaymentMethod::getValue)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok("Payment methods retrieved successfully", methods));
    }
}
