package org.example.nucleicounter.controller;

import org.example.nucleicounter.model.EngineSettings;
import org.example.nucleicounter.service.SettingsNotConfiguredException;
import org.example.nucleicounter.service.SettingsStore;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SettingsController.class)
class SettingsControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private SettingsStore settingsStore;

    @Test
    void getWithoutSettingsIsConflict() throws Exception {
        when(settingsStore.require()).thenThrow(new SettingsNotConfiguredException("Engine not configured."));

        mvc.perform(get("/api/settings"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Engine not configured."));
    }

    @Test
    void getReturnsStoredSettings() throws Exception {
        when(settingsStore.require()).thenReturn(EngineSettings.builder().enginePath("/opt/ImageJ").build());

        mvc.perform(get("/api/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enginePath").value("/opt/ImageJ"))
                .andExpect(jsonPath("$.recipe.thresholdMethod").value("Otsu"));
    }

    @Test
    void putSavesSettingsWithRecipeOverrides() throws Exception {
        when(settingsStore.save(any())).thenAnswer(inv -> inv.getArgument(0));

        mvc.perform(put("/api/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enginePath\": \" /opt/ImageJ \", \"customScriptPath\": \"\","
                                + " \"recipe\": {\"minSize\": 120, \"segmentation\": false}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enginePath").value("/opt/ImageJ"));

        ArgumentCaptor<EngineSettings> saved = ArgumentCaptor.forClass(EngineSettings.class);
        verify(settingsStore).save(saved.capture());
        assertThat(saved.getValue().getCustomScriptPath()).isNull();
        assertThat(saved.getValue().getRecipe().getMinSize()).isEqualTo(120);
        assertThat(saved.getValue().getRecipe().isSegmentation()).isFalse();
        assertThat(saved.getValue().getRecipe().getBlurSigma()).isEqualTo(2.0);
    }

    @Test
    void putRejectsMissingEngineAndOutOfRangeRecipe() throws Exception {
        mvc.perform(put("/api/settings").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());
        mvc.perform(put("/api/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enginePath\": \"/opt/ImageJ\", \"recipe\": {\"maxCircularity\": 1.5}}"))
                .andExpect(status().isBadRequest());
        verify(settingsStore, never()).save(any());
    }

    @Test
    void deleteResetsSettings() throws Exception {
        mvc.perform(delete("/api/settings")).andExpect(status().isNoContent());
        verify(settingsStore).reset();
    }
}
