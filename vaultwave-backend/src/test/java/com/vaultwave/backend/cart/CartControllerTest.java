package com.vaultwave.backend.cart;

import com.vaultwave.backend.auth.CustomUserDetails;
import com.vaultwave.backend.catalog.Product;
import com.vaultwave.backend.user.User;
import com.vaultwave.backend.util.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class CartControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private TestDataFactory data;

    private User user;
    private Product paid;
    private Product free;

    @BeforeEach
    void setUp() {
        data.wipe();
        user = data.user("cart@vaultwave.test");
        paid = data.paidProduct("Low Tide", "6.00", "USD");
        free = data.freeProduct("Field Notes");
    }

    private RequestPostProcessor auth() {
        CustomUserDetails principal = new CustomUserDetails(user);
        return SecurityMockMvcRequestPostProcessors.authentication(
                new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities()));
    }

    private void add(Long productId) throws Exception {
        mockMvc.perform(post("/api/cart/items").with(auth())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":" + productId + "}"))
                .andExpect(status().isOk());
    }

    @Test
    void cartShowsResolvedTotal() throws Exception {
        add(paid.getId());
        add(free.getId());

        mockMvc.perform(get("/api/cart").with(auth()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(2))
                .andExpect(jsonPath("$.total").value(6.00))
                .andExpect(jsonPath("$.currency").value("USD"));
    }

    @Test
    void checkoutCreatesAPendingOrderAndEmptiesTheCart() throws Exception {
        add(paid.getId());

        mockMvc.perform(post("/api/checkout").with(auth())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startPayment\":true}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.order.status").value("PENDING"))
                .andExpect(jsonPath("$.order.totalAmount").value(6.00))
                .andExpect(jsonPath("$.payment.requiresRedirect").value(true));

        mockMvc.perform(get("/api/cart").with(auth()))
                .andExpect(jsonPath("$.items.length()").value(0));
    }

    @Test
    void freeOnlyCheckoutCompletesImmediately() throws Exception {
        add(free.getId());

        mockMvc.perform(post("/api/checkout").with(auth())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startPayment\":true}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.order.status").value("COMPLETED"))
                .andExpect(jsonPath("$.payment.requiresRedirect").value(false));

        mockMvc.perform(get("/api/library").with(auth()))
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void emptyCartCheckoutIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/checkout").with(auth()))
                .andExpect(status().isBadRequest());
    }

    @Test
    void removingAnItem() throws Exception {
        add(paid.getId());

        mockMvc.perform(delete("/api/cart/items/" + paid.getId()).with(auth()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(0));
    }
}
