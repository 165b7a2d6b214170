package com.jcmt.hetitc.web;

import com.jcmt.hetitc.domain.CalculationExtra;
import com.jcmt.hetitc.domain.CalculationMode;
import com.jcmt.hetitc.domain.CalculationRequest;
import com.jcmt.hetitc.domain.CalculationResult;
import com.jcmt.hetitc.domain.MapMode;
import com.jcmt.hetitc.domain.ScanPass;
import com.jcmt.hetitc.error.CalculationOutcome;
import com.jcmt.hetitc.error.ErrorKind;
import com.jcmt.hetitc.service.HeterodyneItcService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CalculationController.class)
class CalculationControllerTest {

    private static final String GRID_BODY = """
            {"receiver": "A3", "mapMode": "GRID", "switchingMode": "PSSW",
             "freq": 233.0, "freqRes": 0.0192, "tau225": 0.23, "zenithAngle": 25.0,
             "pointCount": 25, "rms": 0.6}
            """;

    @Autowired MockMvc mvc;

    @MockitoBean HeterodyneItcService itc;

    @Test
    void success_returns_result_and_diagnostics() throws Exception {
        CalculationExtra extra = CalculationExtra.builder()
                .tRx(62.0).tSys(403.5).tau(0.246).etaSky(0.76)
                .intTime(77.1).elapsedTime(5187.9).rms(0.6)
                .passes(List.of(ScanPass.single(25)))
                .passIntTimes(List.of(77.1))
                .passElapsedTimes(List.of(5187.9))
                .passRmsValues(List.of(0.6))
                .build();
        when(itc.calculate(eq(CalculationMode.RMS), eq(0.6), any()))
                .thenReturn(CalculationOutcome.success(new CalculationResult(CalculationMode.ELAPSED_TIME, 5187.9, extra)));

        mvc.perform(post("/calculate/time").contentType(MediaType.APPLICATION_JSON).content(GRID_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.solved").value("ELAPSED_TIME"))
                .andExpect(jsonPath("$.value").value(5187.9))
                .andExpect(jsonPath("$.intTime").value(77.1))
                .andExpect(jsonPath("$.passes[0].points").value(25));

        ArgumentCaptor<CalculationRequest> request = ArgumentCaptor.forClass(CalculationRequest.class);
        verify(itc).calculate(eq(CalculationMode.RMS), eq(0.6), request.capture());
        assertThat(request.getValue().getMapMode()).isEqualTo(MapMode.GRID);
        assertThat(request.getValue().getPointCount()).isEqualTo(25);
        assertThat(request.getValue().getRaster()).isNull();
    }

    @Test
    void failure_maps_to_unprocessable_entity() throws Exception {
        when(itc.calculate(any(), anyDouble(), any()))
                .thenReturn(CalculationOutcome.failure(ErrorKind.INVALID_MODE, "Switching mode BMSW is not available with map mode RASTER."));

        mvc.perform(post("/calculate/rms-for-int-time").contentType(MediaType.APPLICATION_JSON)
                        .content(GRID_BODY.replace("\"rms\"", "\"intTime\"")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("INVALID_MODE"))
                .andExpect(jsonPath("$.message").value("Switching mode BMSW is not available with map mode RASTER."));
    }

    @Test
    void missing_input_quantity_is_a_bad_request() throws Exception {
        mvc.perform(post("/calculate/rms-for-elapsed-time").contentType(MediaType.APPLICATION_JSON).content(GRID_BODY))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(itc);
    }

    @Test
    void missing_observing_conditions_are_a_bad_request() throws Exception {
        mvc.perform(post("/calculate/time").contentType(MediaType.APPLICATION_JSON)
                        .content(GRID_BODY.replace("\"freq\": 233.0, ", "")))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/calculate/time").contentType(MediaType.APPLICATION_JSON)
                        .content(GRID_BODY.replace("\"tau225\": 0.23, \"zenithAngle\": 25.0,", "")))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(itc);
    }

    @Test
    void malformed_body_is_a_bad_request() throws Exception {
        mvc.perform(post("/calculate/time").contentType(MediaType.APPLICATION_JSON).content("{\"mapMode\": \"SPIRAL\"}"))
                .andExpect(status().isBadRequest());
    }
}
