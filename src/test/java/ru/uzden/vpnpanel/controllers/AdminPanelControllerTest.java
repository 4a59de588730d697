package ru.uzden.vpnpanel.controllers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import ru.uzden.vpnpanel.entities.Location;
import ru.uzden.vpnpanel.entities.Panel;
import ru.uzden.vpnpanel.exceptions.NotFoundException;
import ru.uzden.vpnpanel.exceptions.PanelConnectionException;
import ru.uzden.vpnpanel.exceptions.ServiceException;
import ru.uzden.vpnpanel.model.PanelDraft;
import ru.uzden.vpnpanel.model.SyncOutcome;
import ru.uzden.vpnpanel.services.LocationService;
import ru.uzden.vpnpanel.services.PanelService;

import java.util.List;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AdminPanelControllerTest {

    private static final String TOKEN = "admin-token";

    private final PanelService panelService = mock(PanelService.class);
    private final LocationService locationService = mock(LocationService.class);
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders
                .standaloneSetup(new AdminPanelController(panelService), new AdminLocationController(locationService))
                .setControllerAdvice(new AdminApiExceptionHandler())
                .addInterceptors(new AdminTokenInterceptor(TOKEN))
                .build();
    }

    @Test
    void requestWithoutTokenIsRejected() throws Exception {
        mvc.perform(get("/api/admin/panels"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("unauthorized"));
        mvc.perform(get("/api/admin/panels").header(AdminTokenInterceptor.HEADER, "wrong"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void listNeverExposesCredentials() throws Exception {
        Panel panel = panel();
        when(panelService.listPanels()).thenReturn(List.of(panel));

        mvc.perform(get("/api/admin/panels").header(AdminTokenInterceptor.HEADER, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(1))
                .andExpect(jsonPath("$[0].baseUrl").value("https://de1.example.com"))
                .andExpect(jsonPath("$[0].locationId").value(3))
                .andExpect(content().string(not(containsString("v1:secret"))))
                .andExpect(content().string(not(containsString("encrypted"))));
    }

    @Test
    void createReturns201() throws Exception {
        when(panelService.createPanel(any(PanelDraft.class))).thenReturn(panel());

        mvc.perform(post("/api/admin/panels")
                        .header(AdminTokenInterceptor.HEADER, "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"de-1","baseUrl":"https://de1.example.com","locationId":3,
                                 "username":"admin","password":"pw"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("de-1"));
    }

    @Test
    void deleteWithActiveClientsIsConflict() throws Exception {
        doThrow(new ServiceException("Panel 1 has 2 active clients")).when(panelService).deletePanel(1L);

        mvc.perform(delete("/api/admin/panels/1").header(AdminTokenInterceptor.HEADER, TOKEN))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conflict"))
                .andExpect(jsonPath("$.message").value("Panel 1 has 2 active clients"));
    }

    @Test
    void syncMapsPanelErrors() throws Exception {
        when(panelService.syncPanelInbounds(1L)).thenReturn(new SyncOutcome(3, 1, 1, 0));
        when(panelService.syncPanelInbounds(2L)).thenThrow(new NotFoundException("Panel 2 not found"));
        when(panelService.syncPanelInbounds(3L)).thenThrow(new PanelConnectionException("Panel 3 is unreachable", null));

        mvc.perform(post("/api/admin/panels/1/sync").header(AdminTokenInterceptor.HEADER, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fetched").value(3))
                .andExpect(jsonPath("$.added").value(1));
        mvc.perform(post("/api/admin/panels/2/sync").header(AdminTokenInterceptor.HEADER, TOKEN))
                .andExpect(status().isNotFound());
        mvc.perform(post("/api/admin/panels/3/sync").header(AdminTokenInterceptor.HEADER, TOKEN))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error").value("panel_unreachable"));
    }

    @Test
    void locationsCanBeCreatedAndDeleted() throws Exception {
        Location nl = new Location();
        nl.setId(4L);
        nl.setName("NL");
        nl.setFlag("NL-flag");
        when(locationService.createLocation("NL", "NL-flag")).thenReturn(nl);

        mvc.perform(post("/api/admin/locations")
                        .header(AdminTokenInterceptor.HEADER, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"NL\",\"flag\":\"NL-flag\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(4));
        mvc.perform(delete("/api/admin/locations/4").header(AdminTokenInterceptor.HEADER, TOKEN))
                .andExpect(status().isNoContent());

        verify(locationService).deleteLocation(4L);
    }

    private static Panel panel() {
        Location de = new Location();
        de.setId(3L);
        de.setName("DE");
        Panel p = new Panel();
        p.setId(1L);
        p.setName("de-1");
        p.setBaseUrl("https://de1.example.com");
        p.setLocation(de);
        p.setEncryptedUsername("v1:secret-user");
        p.setEncryptedPassword("v1:secret-pass");
        return p;
    }
}
