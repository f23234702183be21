package com.meetpoll.controller;

import com.meetpoll.context.OrganizerContext;
import com.meetpoll.exception.AlreadyFinalizedException;
import com.meetpoll.exception.NotFoundException;
import com.meetpoll.notification.DispatchReport;
import com.meetpoll.service.MeetingFinalizationService;
import com.meetpoll.service.MeetingService;
import com.meetpoll.service.OrganizerSessionService;
import com.meetpoll.service.SlotRankingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MeetingControllerTest {

    private static final String SESSION = "session-value";

    @Mock
    private OrganizerSessionService sessionService;

    @Mock
    private MeetingService meetingService;

    @Mock
    private SlotRankingService slotRankingService;

    @Mock
    private MeetingFinalizationService finalizationService;

    private MockMvc mockMvc;
    private OrganizerContext ctx;

    @BeforeEach
    void setUp() {
        MeetingController controller = new MeetingController(sessionService, meetingService, slotRankingService,
                finalizationService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
        ctx = new OrganizerContext(UUID.randomUUID(), "owner@example.com");
    }

    @Test
    void list_shouldRequireSession() throws Exception {
        when(sessionService.resolve(null)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/meetings"))
                .andExpect(status().isUnauthorized());
        verifyNoInteractions(meetingService);
    }

    @Test
    void get_shouldMapMissingMeetingToNotFound() throws Exception {
        UUID meetingId = UUID.randomUUID();
        when(sessionService.resolve(SESSION)).thenReturn(Optional.of(ctx));
        when(meetingService.getOverview(ctx, meetingId)).thenThrow(new NotFoundException("Meeting %s not found", meetingId));

        mockMvc.perform(get("/api/meetings/{id}", meetingId).header(OrganizerSessionService.HEADER, SESSION))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    void finalize_shouldReturnResult() throws Exception {
        UUID meetingId = UUID.randomUUID();
        UUID slotId = UUID.randomUUID();
        when(sessionService.resolve(SESSION)).thenReturn(Optional.of(ctx));
        when(finalizationService.finalizeMeeting(ctx, meetingId, slotId)).thenReturn(
                new MeetingFinalizationService.FinalizationResult(meetingId, slotId,
                        "Monday, March 04, 2024 at 09:00 AM", DispatchReport.empty()));

        mockMvc.perform(post("/api/meetings/{id}/finalize", meetingId)
                        .header(OrganizerSessionService.HEADER, SESSION)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotId\":\"" + slotId + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.finalizedSlot").value("Monday, March 04, 2024 at 09:00 AM"))
                .andExpect(jsonPath("$.dispatch.failed").value(0));
    }

    @Test
    void finalize_shouldReportSecondFinalizeAsConflict() throws Exception {
        UUID meetingId = UUID.randomUUID();
        UUID slotId = UUID.randomUUID();
        when(sessionService.resolve(SESSION)).thenReturn(Optional.of(ctx));
        when(finalizationService.finalizeMeeting(ctx, meetingId, slotId))
                .thenThrow(new AlreadyFinalizedException(meetingId));

        mockMvc.perform(post("/api/meetings/{id}/finalize", meetingId)
                        .header(OrganizerSessionService.HEADER, SESSION)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotId\":\"" + slotId + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("INVALID_STATE"));
    }

    @Test
    void finalize_shouldRequireSlot() throws Exception {
        UUID meetingId = UUID.randomUUID();
        when(sessionService.resolve(SESSION)).thenReturn(Optional.of(ctx));

        mockMvc.perform(post("/api/meetings/{id}/finalize", meetingId)
                        .header(OrganizerSessionService.HEADER, SESSION)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(finalizationService);
    }

    @Test
    void create_shouldRejectUnreadableBody() throws Exception {
        mockMvc.perform(post("/api/meetings")
                        .header(OrganizerSessionService.HEADER, SESSION)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_ARGUMENT"));
        verify(meetingService, never()).createMeeting(any(), any());
    }
}
