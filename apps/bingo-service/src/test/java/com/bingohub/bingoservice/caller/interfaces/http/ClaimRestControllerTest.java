package com.bingohub.bingoservice.caller.interfaces.http;

import com.bingohub.bingoservice.caller.service.CallerSessionService;
import com.bingohub.bingoservice.common.WebExceptionAdvice;
import com.bingohub.realtime.claim.ClaimResolution;
import com.bingohub.realtime.claim.ClaimView;
import com.bingohub.realtime.claim.PrizeAllocation;
import com.bingohub.realtime.claim.WinPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ClaimRestControllerTest {

    private CallerSessionService svc;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        svc = mock(CallerSessionService.class);
        mvc = MockMvcBuilders.standaloneSetup(new ClaimRestController(svc))
                .setControllerAdvice(new WebExceptionAdvice())
                .build();
    }

    @Test
    void decisionAcceptsWireAllocation() throws Exception {
        ClaimResolution resolution = new ClaimResolution("r-1", "s1", "g-1", WinPattern.ONE_LINE, 0L,
                ClaimResolution.Kind.GROUP, List.of("c-1", "c-2"), PrizeAllocation.EACH_FULL, 10L);
        when(svc.decide("s1", "g-1", PrizeAllocation.EACH_FULL)).thenReturn(resolution);

        mvc.perform(post("/api/sessions/s1/claims/groups/g-1/decision").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"allocation\":\"each-full\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.winnerClaimIds.length()").value(2));
    }

    @Test
    void unknownAllocationIsBadRequest() throws Exception {
        mvc.perform(post("/api/sessions/s1/claims/groups/g-1/decision").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"allocation\":\"winner-takes-all\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("未知的分奖方式: winner-takes-all"));
    }

    @Test
    void rejectWorksWithoutBody() throws Exception {
        ClaimView view = new ClaimView("c-1", "s1", "p-1", "Alice", "t-1", "oneLine", 0L, "rejected", 1L,
                "g-1", null, "caller-rejected", "叫号方驳回了该声明", null, List.of());
        when(svc.reject(any(), any(), isNull())).thenReturn(view);

        mvc.perform(post("/api/sessions/s1/claims/c-1/reject"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("rejected"));
        verify(svc).reject("s1", "c-1", null);
    }

    @Test
    void listCombinesClaimsAndGroups() throws Exception {
        when(svc.claims("s1")).thenReturn(List.of());
        when(svc.groups("s1")).thenReturn(List.of());

        mvc.perform(get("/api/sessions/s1/claims"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.claims").isArray())
                .andExpect(jsonPath("$.data.groups").isArray());
    }
}
