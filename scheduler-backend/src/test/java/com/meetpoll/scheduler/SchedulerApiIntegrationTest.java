package com.meetpoll.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetpoll.service.OrganizerSessionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.RequestBuilder;
import org.springframework.test.web.servlet.ResultMatcher;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class SchedulerApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void organizerAndParticipantFlow_shouldScheduleMeeting() throws Exception {
        String session = registerAndLogin();

        String aliceId = read(authorizedPost("/api/contacts", session, "{\"name\":\"Alice\",\"email\":\"alice@example.com\"}"),
                status().isOk()).get("id").asText();
        String bobId = read(authorizedPost("/api/contacts", session, "{\"name\":\"Bob\",\"email\":\"bob@example.com\"}"),
                status().isOk()).get("id").asText();

        String meetingBody = """
                {"title":"Planning","description":"Quarterly planning",
                 "slots":[{"startsAt":"2024-03-04T09:00:00Z","durationMinutes":60},
                          {"startsAt":"2024-03-05T14:00:00Z","durationMinutes":30}],
                 "contactIds":["%s","%s"]}
                """.formatted(aliceId, bobId);
        JsonNode created = read(authorizedPost("/api/meetings?send=true", session, meetingBody), status().isCreated());
        assertEquals(true, created.get("sent").asBoolean());
        assertEquals(2, created.get("dispatch").get("simulated").asInt());
        String meetingId = created.get("meetingId").asText();

        JsonNode overview = read(get("/api/meetings/" + meetingId).header(OrganizerSessionService.HEADER, session),
                status().isOk());
        assertEquals("SENT", overview.get("meeting").get("status").asText());
        String mondaySlot = overview.get("slots").get(0).get("id").asText();
        String tuesdaySlot = overview.get("slots").get(1).get("id").asText();
        String aliceToken = tokenOf(overview, "Alice");
        String bobToken = tokenOf(overview, "Bob");

        mockMvc.perform(get("/api/respond").param("token", aliceToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meetingTitle").value("Planning"))
                .andExpect(jsonPath("$.participantName").value("Alice"))
                .andExpect(jsonPath("$.slots.length()").value(2));

        mockMvc.perform(post("/api/respond").param("token", aliceToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answers\":{\"%s\":\"AVAILABLE\",\"%s\":\"MAYBE\"}}".formatted(mondaySlot, tuesdaySlot)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recorded").value(2))
                .andExpect(jsonPath("$.firstSubmission").value(true));
        mockMvc.perform(put("/api/respond/slots/" + mondaySlot).param("token", bobToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"availability\":\"AVAILABLE\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/meetings/" + meetingId + "/ranking").header(OrganizerSessionService.HEADER, session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].slotId").value(mondaySlot))
                .andExpect(jsonPath("$[0].available").value(2))
                .andExpect(jsonPath("$[1].maybe").value(1))
                .andExpect(jsonPath("$[1].pending").value(1));

        mockMvc.perform(post("/api/meetings/" + meetingId + "/finalize")
                        .header(OrganizerSessionService.HEADER, session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotId\":\"" + mondaySlot + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dispatch.simulated").value(2));

        mockMvc.perform(post("/api/meetings/" + meetingId + "/finalize")
                        .header(OrganizerSessionService.HEADER, session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotId\":\"" + tuesdaySlot + "\"}"))
                .andExpect(status().isConflict());
        mockMvc.perform(put("/api/respond/slots/" + tuesdaySlot).param("token", bobToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"availability\":\"MAYBE\"}"))
                .andExpect(status().isConflict());
        mockMvc.perform(get("/api/respond").param("token", bobToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FINALIZED"));

        mockMvc.perform(delete("/api/contacts/" + aliceId).header(OrganizerSessionService.HEADER, session))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.removed").value(false));
    }

    @Test
    void unknownTokenAndMissingSession_shouldBeRejected() throws Exception {
        mockMvc.perform(get("/api/respond").param("token", "no-such-token"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/respond"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Invalid or expired response link"));
        mockMvc.perform(put("/api/respond/slots/" + UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"availability\":\"AVAILABLE\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
        mockMvc.perform(post("/api/respond")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/meetings"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/meetings").header(OrganizerSessionService.HEADER, "forged.session.value"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void mailSettings_shouldSaveWithoutEchoingPassword() throws Exception {
        String session = registerAndLogin();
        mockMvc.perform(get("/api/mail-settings"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/mail-settings").header(OrganizerSessionService.HEADER, session))
                .andExpect(status().isNoContent());

        mockMvc.perform(put("/api/mail-settings")
                        .header(OrganizerSessionService.HEADER, session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"host":"smtp.owner.test","port":2525,"username":"owner","password":"app-password"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.passwordSet").value(true))
                .andExpect(jsonPath("$.password").doesNotExist());
        mockMvc.perform(get("/api/mail-settings").header(OrganizerSessionService.HEADER, session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.host").value("smtp.owner.test"))
                .andExpect(jsonPath("$.port").value(2525));

        mockMvc.perform(put("/api/mail-settings")
                        .header(OrganizerSessionService.HEADER, session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"host\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_ARGUMENT"));

        mockMvc.perform(delete("/api/mail-settings").header(OrganizerSessionService.HEADER, session))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/mail-settings").header(OrganizerSessionService.HEADER, session))
                .andExpect(status().isNoContent());
    }

    private String registerAndLogin() throws Exception {
        String email = "organizer-" + UUID.randomUUID() + "@example.com";
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","password":"correct-horse","displayName":"Organizer","recoveryPhrase":"blue whale"}
                                """.formatted(email)))
                .andExpect(status().isCreated());
        String login = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"%s\",\"password\":\"correct-horse\"}".formatted(email)))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(login).get("session").asText();
    }

    private static MockHttpServletRequestBuilder authorizedPost(String path, String session, String body) {
        return post(path)
                .header(OrganizerSessionService.HEADER, session)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body);
    }

    private JsonNode read(RequestBuilder request, ResultMatcher expected)
            throws Exception {
        String body = mockMvc.perform(request)
                .andExpect(expected)
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    private static String tokenOf(JsonNode overview, String participantName) {
        for (JsonNode participant : overview.get("participants")) {
            if (participantName.equals(participant.get("name").asText())) {
                String link = participant.get("responseLink").asText();
                return link.substring(link.indexOf("token=") + "token=".length());
            }
        }
        throw new AssertionError("No participant named " + participantName);
    }
}
