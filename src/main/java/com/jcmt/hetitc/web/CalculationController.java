package com.jcmt.hetitc.web;

import com.jcmt.hetitc.domain.CalculationExtra;
import com.jcmt.hetitc.domain.CalculationMode;
import com.jcmt.hetitc.domain.CalculationResult;
import com.jcmt.hetitc.domain.ScanPass;
import com.jcmt.hetitc.domain.Sideband;
import com.jcmt.hetitc.error.CalculationOutcome;
import com.jcmt.hetitc.error.ErrorKind;
import com.jcmt.hetitc.service.HeterodyneItcService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/calculate")
public class CalculationController {

    private final HeterodyneItcService itc;

    public CalculationController(HeterodyneItcService itc) {
        this.itc = itc;
    }

    @PostMapping("/time")
    public ResponseEntity<?> time(@RequestBody CalculationBody body) {
        return respond(CalculationMode.RMS, require(body.getRms(), "rms"), body);
    }

    @PostMapping("/rms-for-elapsed-time")
    public ResponseEntity<?> rmsForElapsedTime(@RequestBody CalculationBody body) {
        return respond(CalculationMode.ELAPSED_TIME, require(body.getElapsedTime(), "elapsedTime"), body);
    }

    @PostMapping("/rms-for-int-time")
    public ResponseEntity<?> rmsForIntTime(@RequestBody CalculationBody body) {
        return respond(CalculationMode.INT_TIME, require(body.getIntTime(), "intTime"), body);
    }

    private ResponseEntity<?> respond(CalculationMode mode, double value, CalculationBody body) {
        require(body.getFreq(), "freq");
        require(body.getFreqRes(), "freqRes");
        require(body.getTau225(), "tau225");
        require(body.getZenithAngle(), "zenithAngle");
        CalculationOutcome outcome = itc.calculate(mode, value, body.toRequest());
        if (!outcome.isSuccess()) {
            log.warn("calculation_failed: receiver={} mode={} kind={} msg={}",
                    body.getReceiver(), mode, outcome.getErrorKind(), outcome.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(new ErrorView(outcome.getErrorKind(), outcome.getMessage()));
        }
        return ResponseEntity.ok(CalculationView.of(outcome.getResult()));
    }

    private static double require(Double value, String field) {
        if (value == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing field: " + field);
        }
        return value;
    }

    public record ErrorView(ErrorKind kind, String message) {}

    public record PassView(int points, int rows, double dy, double multiscan,
                           double intTime, double elapsedTime, double rms) {}

    public record CalculationView(CalculationMode solved, double value,
                                  double tRx, double tSys, double tau, double etaSky,
                                  Double ifFreq, Double loFreq, Sideband sideband,
                                  boolean tSysFitApplied, Double calibrationFactor,
                                  double intTime, double elapsedTime, double rms,
                                  Double basketWeaveFraction, List<PassView> passes) {

        static CalculationView of(CalculationResult result) {
            CalculationExtra x = result.getExtra();
            List<PassView> passes = new ArrayList<>();
            for (int i = 0; i < x.getPasses().size(); i++) {
                ScanPass p = x.getPasses().get(i);
                passes.add(new PassView(p.points(), p.rows(), p.dy(), p.multiscan(),
                        x.getPassIntTimes().get(i), x.getPassElapsedTimes().get(i), x.getPassRmsValues().get(i)));
            }
            return new CalculationView(result.getSolved(), result.getValue(),
                    x.getTRx(), x.getTSys(), x.getTau(), x.getEtaSky(),
                    x.getIfFreq(), x.getLoFreq(), x.getSideband(),
                    x.isTSysFitApplied(), x.getCalibrationFactor(),
                    x.getIntTime(), x.getElapsedTime(), x.getRms(),
                    x.getBasketWeaveFraction(), passes);
        }
    }
}
