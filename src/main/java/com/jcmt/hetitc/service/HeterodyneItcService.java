package com.jcmt.hetitc.service;

import com.jcmt.hetitc.catalog.ReceiverCatalog;
import com.jcmt.hetitc.domain.CalculationExtra;
import com.jcmt.hetitc.domain.CalculationMode;
import com.jcmt.hetitc.domain.CalculationRequest;
import com.jcmt.hetitc.domain.CalculationResult;
import com.jcmt.hetitc.domain.DurationParam;
import com.jcmt.hetitc.domain.MapMode;
import com.jcmt.hetitc.domain.Maths;
import com.jcmt.hetitc.domain.RasterSpec;
import com.jcmt.hetitc.domain.ReceiverInfo;
import com.jcmt.hetitc.domain.ScanPass;
import com.jcmt.hetitc.domain.SwitchingMode;
import com.jcmt.hetitc.error.CalculationOutcome;
import com.jcmt.hetitc.error.ErrorKind;
import com.jcmt.hetitc.error.FrequencyRangeException;
import com.jcmt.hetitc.error.HeterodyneItcException;
import com.jcmt.hetitc.error.MinimumSampleTimeException;
import com.jcmt.hetitc.service.SystemTemperatureModel.SystemTemperature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Heterodyne integration time calculator.
 * <p>
 * Given one of target RMS, elapsed time or integration time per point,
 * computes the other two. Rasters may be basket-woven, in which case each of
 * the two scan directions covers the whole map and takes a share of the time
 * per point sized to give both directions the same noise. Elapsed times and
 * integration times per point are summed, and noise values combined as
 * independent measurements.
 */
@Slf4j
@Service
public class HeterodyneItcService {

    private static final String ORIGIN_RMS = "requested target sensitivity";
    private static final String ORIGIN_ELAPSED = "requested elapsed time";

    private final ReceiverCatalog catalog;
    private final SystemTemperatureModel systemTemperature;
    private final DurationModel durations;
    private final RmsTimeConverter converter;
    private final RasterGeometry geometry;
    private final BasketWeaveSplitter splitter;
    private final ItcSettings settings;

    public HeterodyneItcService(ReceiverCatalog catalog,
                                SystemTemperatureModel systemTemperature,
                                DurationModel durations,
                                RmsTimeConverter converter,
                                RasterGeometry geometry,
                                BasketWeaveSplitter splitter,
                                ItcSettings settings) {
        this.catalog = catalog;
        this.systemTemperature = systemTemperature;
        this.durations = durations;
        this.converter = converter;
        this.geometry = geometry;
        this.splitter = splitter;
        this.settings = settings;
    }

    /** Wires the engine by hand around a catalog, for use outside a Spring context. */
    public static HeterodyneItcService create(ReceiverCatalog catalog, ItcSettings settings) {
        return new HeterodyneItcService(catalog,
                new SystemTemperatureModel(catalog),
                new DurationModel(),
                new RmsTimeConverter(settings),
                new RasterGeometry(),
                new BasketWeaveSplitter(settings),
                settings);
    }

    // ---------------------- Public API ----------------------

    /**
     * @param mode  which quantity {@code value} is: target RMS (K), elapsed time (s)
     *              or integration time per point (s)
     */
    public CalculationOutcome calculate(CalculationMode mode, double value, CalculationRequest request) {
        try {
            return CalculationOutcome.success(compute(mode, value, request));
        } catch (HeterodyneItcException e) {
            log.debug("calculation_rejected: kind={} msg={}", e.getKind(), e.getMessage());
            return CalculationOutcome.failure(e.getKind(), e.getMessage());
        }
    }

    /** Elapsed time needed to reach {@code rms}. */
    public CalculationResult calculateTime(double rms, CalculationRequest request) {
        return calculate(CalculationMode.RMS, rms, request).orElseThrow();
    }

    public CalculationResult calculateRmsForElapsedTime(double elapsedTime, CalculationRequest request) {
        return calculate(CalculationMode.ELAPSED_TIME, elapsedTime, request).orElseThrow();
    }

    public CalculationResult calculateRmsForIntTime(double intTime, CalculationRequest request) {
        return calculate(CalculationMode.INT_TIME, intTime, request).orElseThrow();
    }

    /** Noise of independent measurements combined: (Σ rms⁻²)^(-1/2). */
    public static double combineRms(List<Double> values) {
        return Maths.combineRms(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    // ---------------------- Calculation ----------------------

    private CalculationResult compute(CalculationMode mode, double value, CalculationRequest req) {
        ReceiverInfo receiver = validate(mode, value, req);

        SystemTemperature tSys = systemTemperature.calculate(receiver, req.getFreq(), req.getTau225(),
                req.getZenithAngle(), req.isDsb(), req.getIfFreq(), req.getSideband());

        List<ScanPass> passes = (req.getMapMode() == MapMode.RASTER)
                ? geometry.passes(receiver, req.getRaster(), req.isBasketWeave())
                : List.of(ScanPass.single(req.getPointCount()));

        List<PassPlan> plans = new ArrayList<>(passes.size());
        for (ScanPass pass : passes) {
            DurationParam param = durations.parameters(req.getMapMode(), req.getSwitchingMode(), pass.points(),
                    req.isSeparateOffs(), req.isContinuum());
            RmsTimeConverter.Context ctx = new RmsTimeConverter.Context(tSys.getTSys(), req.getFreqRes(),
                    pass.points(), req.getMapMode(), req.getSwitchingMode(), req.isSeparateOffs(),
                    req.isDualPolarization(), pass.multiscan());
            plans.add(new PassPlan(pass, param, ctx));
        }

        double minimum = settings.intTimeMinimum(req.isBasketWeave());
        List<PassOutcome> outcomes = new ArrayList<>(plans.size());
        Double fraction = null;

        switch (mode) {
            case RMS -> {
                double perPass = value * Math.sqrt(plans.size());
                for (PassPlan plan : plans) {
                    outcomes.add(forIntTime(plan, converter.intTime(plan.ctx(), perPass)));
                }
                double t = totalIntTime(outcomes);
                if (t < minimum) {
                    throw new MinimumSampleTimeException(ORIGIN_RMS, t, minimum, req.isBasketWeave());
                }
            }
            case ELAPSED_TIME -> {
                if (plans.size() == 1) {
                    PassPlan plan = plans.get(0);
                    double t = intTimeFromElapsed(plan, value);
                    if (t < minimum) {
                        throw new MinimumSampleTimeException(ORIGIN_ELAPSED, t, minimum, req.isBasketWeave());
                    }
                    outcomes.add(new PassOutcome(t, value, converter.rms(plan.ctx(), t)));
                } else {
                    PassPlan first = plans.get(0);
                    PassPlan second = plans.get(1);
                    double directionMinimum = settings.getIntTimeMinimum();
                    BasketWeaveSplitter.Split split = splitter.split(value,
                            budget -> directionRms(first, budget, directionMinimum),
                            budget -> directionRms(second, budget, directionMinimum));
                    fraction = split.fraction();
                    double firstBudget = split.fraction() * value;
                    double secondBudget = value - firstBudget;
                    outcomes.add(new PassOutcome(intTimeFromElapsed(first, firstBudget), firstBudget, split.firstRms()));
                    outcomes.add(new PassOutcome(intTimeFromElapsed(second, secondBudget), secondBudget, split.secondRms()));
                }
            }
            case INT_TIME -> {
                if (value < minimum) {
                    throw new MinimumSampleTimeException(null, value, minimum, req.isBasketWeave());
                }
                double[] weights = new double[plans.size()];
                double weightSum = 0.0;
                for (int i = 0; i < weights.length; i++) {
                    double unit = converter.rms(plans.get(i).ctx(), 1.0);
                    weights[i] = unit * unit;
                    weightSum += weights[i];
                }
                for (int i = 0; i < weights.length; i++) {
                    outcomes.add(forIntTime(plans.get(i), value * (weights[i] / weightSum)));
                }
            }
        }

        double elapsed = outcomes.stream().mapToDouble(PassOutcome::elapsedTime).sum();
        double rms = Maths.combineRms(outcomes.stream().mapToDouble(PassOutcome::rms).toArray());
        double intTime = totalIntTime(outcomes);

        CalculationExtra extra = CalculationExtra.builder()
                .tRx(tSys.getTRx())
                .tSys(tSys.getTSys())
                .tau(tSys.getTau())
                .etaSky(tSys.getEtaSky())
                .ifFreq(tSys.getIfFreq())
                .loFreq(tSys.getLoFreq())
                .sideband(tSys.getSideband())
                .tSysFitApplied(tSys.isFitApplied())
                .calibrationFactor(tSys.getCalibrationFactor())
                .intTime(intTime)
                .elapsedTime(elapsed)
                .rms(rms)
                .passes(passes)
                .passIntTimes(outcomes.stream().map(PassOutcome::intTime).toList())
                .passElapsedTimes(outcomes.stream().map(PassOutcome::elapsedTime).toList())
                .passRmsValues(outcomes.stream().map(PassOutcome::rms).toList())
                .basketWeaveFraction(fraction)
                .build();

        if (log.isDebugEnabled()) {
            log.debug("{} {} {}+{} from {}={}: tSys={} intTime={} elapsed={} rms={} passes={}",
                    receiver.getName(), req.getFreq(), req.getMapMode(), req.getSwitchingMode(),
                    mode, value, tSys.getTSys(), intTime, elapsed, rms, passes.size());
        }

        return switch (mode) {
            case RMS -> new CalculationResult(CalculationMode.ELAPSED_TIME, elapsed, extra);
            case ELAPSED_TIME, INT_TIME -> new CalculationResult(CalculationMode.RMS, rms, extra);
        };
    }

    /** Time spent on each map point, summed over the scan directions. */
    private static double totalIntTime(List<PassOutcome> outcomes) {
        return outcomes.stream().mapToDouble(PassOutcome::intTime).sum();
    }

    private PassOutcome forIntTime(PassPlan plan, double t) {
        double elapsed = durations.elapsedTime(plan.param(), plan.pass().points(), plan.pass().rows(), t);
        return new PassOutcome(t, elapsed, converter.rms(plan.ctx(), t));
    }

    private double intTimeFromElapsed(PassPlan plan, double elapsed) {
        return durations.intTime(plan.param(), plan.pass().points(), plan.pass().rows(), elapsed);
    }

    private OptionalDouble directionRms(PassPlan plan, double budget, double minimum) {
        double t = intTimeFromElapsed(plan, budget);
        return (t < minimum) ? OptionalDouble.empty() : OptionalDouble.of(converter.rms(plan.ctx(), t));
    }

    // ---------------------- Validation ----------------------

    private ReceiverInfo validate(CalculationMode mode, double value, CalculationRequest req) {
        if (mode == null) throw invalidParameter("The calculation mode is required.");
        if (req == null) throw invalidParameter("The calculation parameters are required.");
        if (req.getReceiver() == null) throw invalidParameter("The receiver is required.");
        if (req.getMapMode() == null) throw invalidParameter("The map mode is required.");
        if (req.getSwitchingMode() == null) throw invalidParameter("The switching mode is required.");

        MapMode map = req.getMapMode();
        SwitchingMode sw = req.getSwitchingMode();
        if (!map.allows(sw)) {
            throw new HeterodyneItcException(ErrorKind.INVALID_MODE,
                    "Switching mode " + sw + " is not available with map mode " + map + ".");
        }
        if (req.isSeparateOffs() && map == MapMode.RASTER) {
            throw new HeterodyneItcException(ErrorKind.INVALID_MODE,
                    "Separate offs can not be used with raster maps.");
        }
        if (req.isSeparateOffs() && map == MapMode.GRID && sw == SwitchingMode.PSSW) {
            throw new HeterodyneItcException(ErrorKind.INVALID_MODE,
                    "Separate offs can not be used with position switched grids.");
        }
        if (req.isBasketWeave() && map != MapMode.RASTER) {
            throw new HeterodyneItcException(ErrorKind.INVALID_MODE,
                    "Basket weaving can only be used with raster maps.");
        }

        ReceiverInfo receiver = catalog.getReceiverInfo(req.getReceiver());

        if (req.isDsb() && !receiver.isDsbAvailable()) {
            throw unsupported("Receiver " + receiver.getName() + " does not support DSB observations.");
        }
        if (!req.isDsb() && !receiver.isSsbAvailable()) {
            throw unsupported("Receiver " + receiver.getName() + " does not support SSB observations.");
        }
        if (req.isDualPolarization() && receiver.getMixers() < 2) {
            throw unsupported("Receiver " + receiver.getName() + " does not support dual polarization observations.");
        }
        if (sw == SwitchingMode.FRSW && !receiver.isFrswAvailable()) {
            throw unsupported("Receiver " + receiver.getName() + " does not support frequency switching.");
        }

        if (req.getFreq() < receiver.getFreqMin() || req.getFreq() > receiver.getFreqMax()) {
            throw new FrequencyRangeException("frequency", req.getFreq(), receiver.getFreqMin(), receiver.getFreqMax());
        }
        if (!(req.getFreqRes() > 0.0)) throw invalidParameter("The frequency resolution must be positive.");
        if (!(req.getTau225() >= 0.0)) throw invalidParameter("The 225 GHz opacity must not be negative.");
        if (!(req.getZenithAngle() >= 0.0 && req.getZenithAngle() <= 90.0)) {
            throw invalidParameter("The zenith angle must be between 0 and 90 degrees.");
        }

        if (map == MapMode.RASTER) {
            RasterSpec raster = req.getRaster();
            if (raster == null) throw invalidParameter("Raster maps require the map dimensions and spacing.");
            if (!(raster.getWidth() > 0.0 && raster.getHeight() > 0.0)) {
                throw invalidParameter("The raster width and height must be positive.");
            }
            if (!(raster.getDx() > 0.0 && raster.getDy() > 0.0)) {
                throw invalidParameter("The raster pixel size and scan spacing must be positive.");
            }
        } else if (req.getPointCount() == null || req.getPointCount() < 1) {
            throw invalidParameter("The number of points must be at least 1.");
        }

        if (mode == CalculationMode.RMS && !(value > 0.0)) {
            throw invalidParameter("The target sensitivity must be positive.");
        }
        if (mode == CalculationMode.ELAPSED_TIME && !(value > 0.0)) {
            throw invalidParameter("The elapsed time must be positive.");
        }
        return receiver;
    }

    private static HeterodyneItcException invalidParameter(String message) {
        return new HeterodyneItcException(ErrorKind.INVALID_PARAMETER, message);
    }

    private static HeterodyneItcException unsupported(String message) {
        return new HeterodyneItcException(ErrorKind.UNSUPPORTED_RECEIVER_OPTION, message);
    }

    private record PassPlan(ScanPass pass, DurationParam param, RmsTimeConverter.Context ctx) {}

    private record PassOutcome(double intTime, double elapsedTime, double rms) {}
}
