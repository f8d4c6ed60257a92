package com.shop.stockkeeper.controller;

import com.shop.stockkeeper.model.Shop;
import com.shop.stockkeeper.model.User;
import com.shop.stockkeeper.model.UserRole;
import com.shop.stockkeeper.repository.ShopRepository;
import com.shop.stockkeeper.repository.UserRepository;
import com.shop.stockkeeper.security.ShopUserPrincipal;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = "shop.policy.item-mutation=admin-only")
@AutoConfigureMockMvc
class AdminOnlyItemPolicyTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private UserRepository userRepository;
    @Autowired
    private ShopRepository shopRepository;

    @Test
    void createItem_ShouldRedirectWorker() throws Exception {
        User user = new User();
        user.setUsername("policy-" + UUID.randomUUID());
        user.setPassword("pw");
        user.setRole(UserRole.WORKER);
        userRepository.save(user);
        Shop shop = shopRepository.save(new Shop("Policy " + UUID.randomUUID()));

        mockMvc.perform(post("/api/items")
                .with(authentication(UsernamePasswordAuthenticationToken.authenticated(ShopUserPrincipal.of(user),
                        null, List.of(new SimpleGrantedAuthority("ROLE_WORKER")))))
                .sessionAttr("shop_id", shop.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Widget\",\"price\":1.00,\"quantity\":1}"))
                .andExpect(status().isSeeOther())
                .andExpect(header().string("Location", "/api/items"));
    }
}
