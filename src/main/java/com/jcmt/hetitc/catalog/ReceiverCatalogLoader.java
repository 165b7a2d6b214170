package com.jcmt.hetitc.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jcmt.hetitc.domain.ArrayInfo;
import com.jcmt.hetitc.domain.CalibrationLoads;
import com.jcmt.hetitc.domain.HarmonicModel;
import com.jcmt.hetitc.domain.InterpolationTable;
import com.jcmt.hetitc.domain.ReceiverInfo;
import com.jcmt.hetitc.domain.TSysFit;
import com.jcmt.hetitc.domain.TemperatureCurve;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the receiver JSON and the opacity tables from the classpath.
 * <p>
 * Receiver temperature entries are either lists of [x, y] pairs (interpolation
 * tables) or flat lists of numbers (harmonic model coefficients).
 * Opacity tables live in {@code <tauDir>/tauNNN.dat}, NNN being the three
 * decimals of the 225 GHz opacity, one "frequency opacity" pair per line.
 */
@Slf4j
public class ReceiverCatalogLoader {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final String receiversResource;
    private final String tauDir;

    public ReceiverCatalogLoader(String receiversResource, String tauDir) {
        this.receiversResource = receiversResource;
        this.tauDir = tauDir.endsWith("/") ? tauDir.substring(0, tauDir.length() - 1) : tauDir;
    }

    public StaticReceiverCatalog load() throws IOException {
        JsonNode root;
        try (InputStream in = open(receiversResource)) {
            root = objectMapper.readTree(in);
        }

        Map<String, ReceiverInfo> receivers = new LinkedHashMap<>();
        for (JsonNode node : root.path("receivers")) {
            ReceiverInfo info = parseReceiver(node);
            receivers.put(info.getName(), info);
        }

        Map<Double, InterpolationTable> opacity = new LinkedHashMap<>();
        for (JsonNode ref : root.path("opacity")) {
            double tau = ref.asDouble();
            opacity.put(tau, readTauTable(tau));
        }

        log.info("Receiver catalog loaded: receivers={} opacityTables={}", receivers.keySet(), opacity.size());
        return new StaticReceiverCatalog(receivers, opacity);
    }

    ReceiverInfo parseReceiver(JsonNode node) {
        String name = requireText(node, "name");
        ReceiverInfo.ReceiverInfoBuilder b = ReceiverInfo.builder()
                .name(name)
                .freqMin(requireDouble(node, "f_min", name))
                .freqMax(requireDouble(node, "f_max", name))
                .mixers(node.path("n_mix").asInt(1))
                .ssbAvailable(node.path("ssb_available").asBoolean(false))
                .dsbAvailable(node.path("dsb_available").asBoolean(false))
                .frswAvailable(node.path("frsw_available").asBoolean(false))
                .etaTel(requireDouble(node, "eta_tel", name))
                .tRx(curve(node.get("t_rx"), name))
                .tRxLsb(curve(node.get("t_rx_lsb"), name))
                .tRxUsb(curve(node.get("t_rx_usb"), name))
                .ifFreq(optionalDouble(node, "f_if"))
                .ifMin(optionalDouble(node, "if_min"))
                .ifMax(optionalDouble(node, "if_max"))
                .loMin(optionalDouble(node, "lo_min"))
                .loMax(optionalDouble(node, "lo_max"));

        JsonNode ifCorrection = node.get("t_rx_if");
        if (ifCorrection != null && !ifCorrection.isNull()) {
            if (!isPairList(ifCorrection)) {
                throw new IllegalStateException("Receiver " + name + ": t_rx_if must be a list of [if, t] pairs");
            }
            b.tRxIf(table(ifCorrection));
        }

        for (JsonNode brk : node.path("sideband_preference")) {
            b.sidebandBreak(brk.asDouble());
        }

        JsonNode array = node.get("array");
        if (array != null && !array.isNull()) b.array(parseArray(array, name));

        JsonNode fit = node.get("t_sys_fit");
        if (fit != null && !fit.isNull()) b.tSysFit(parseFit(fit, name));

        JsonNode cal = node.get("calibration");
        if (cal != null && !cal.isNull()) {
            b.calibration(new CalibrationLoads(
                    requireDouble(cal, "t_load", name),
                    requireDouble(cal, "t_spill", name),
                    requireDouble(cal, "t_air", name)));
        }

        ReceiverInfo info = b.build();
        if (info.getTRx() == null && !info.isLoIndexed()) {
            throw new IllegalStateException("Receiver " + name + " has no receiver temperature data");
        }
        if (info.isLoIndexed() && info.getIfFreq() == null) {
            throw new IllegalStateException("Receiver " + name + " is LO-indexed but has no default f_if");
        }
        log.debug("Parsed receiver {}: {}-{} GHz loIndexed={} array={}",
                name, info.getFreqMin(), info.getFreqMax(), info.isLoIndexed(), info.isArray());
        return info;
    }

    private ArrayInfo parseArray(JsonNode node, String name) {
        ArrayInfo.ArrayInfoBuilder b = ArrayInfo.builder()
                .size(requireDouble(node, "size", name))
                .tiltAngle(node.path("f_angle").asDouble(0.0));
        if (node.has("fraction_available")) {
            b.fractionAvailable(node.get("fraction_available").asDouble());
        }
        for (JsonNode pair : node.path("scan_spacings")) {
            b.scanSpacing(pair.get(0).asText(), pair.get(1).asDouble());
        }
        for (JsonNode pair : node.path("jiggle_patterns")) {
            b.jigglePattern(pair.get(0).asText(), pair.get(1).asInt());
        }
        return b.build();
    }

    private TSysFit parseFit(JsonNode node, String name) {
        JsonNode c = node.path("coefficients");
        if (c.size() != 3) {
            throw new IllegalStateException("Receiver " + name + ": t_sys_fit needs three coefficients");
        }
        TSysFit.TSysFitBuilder b = TSysFit.builder()
                .referenceFreq(requireDouble(node, "reference_freq", name))
                .quadratic(c.get(0).asDouble())
                .linear(c.get(1).asDouble())
                .constant(c.get(2).asDouble())
                .maxTau(requireDouble(node, "max_tau", name))
                .maxZenith(requireDouble(node, "max_zenith", name));
        for (JsonNode band : node.path("bands")) {
            b.band(new TSysFit.Band(band.get(0).asDouble(), band.get(1).asDouble()));
        }
        return b.build();
    }

    private static TemperatureCurve curve(JsonNode node, String name) {
        if (node == null || node.isNull()) return null;
        if (!node.isArray() || node.isEmpty()) {
            throw new IllegalStateException("Receiver " + name + ": temperature data must be a non-empty list");
        }
        if (isPairList(node)) return table(node);

        List<Double> coefficients = new ArrayList<>();
        for (JsonNode v : node) coefficients.add(v.asDouble());
        return HarmonicModel.fromCoefficients(coefficients);
    }

    private static boolean isPairList(JsonNode node) {
        return node.isArray() && !node.isEmpty() && node.get(0).isArray();
    }

    private static InterpolationTable table(JsonNode node) {
        List<double[]> pairs = new ArrayList<>();
        for (JsonNode pair : node) {
            pairs.add(new double[]{pair.get(0).asDouble(), pair.get(1).asDouble()});
        }
        return InterpolationTable.of(pairs);
    }

    InterpolationTable readTauTable(double tau225) throws IOException {
        String code = String.format(Locale.ROOT, "%.3f", tau225).substring(2);
        String path = tauDir + "/tau" + code + ".dat";
        List<double[]> pairs = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(open(path), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] cols = line.split("\\s+");
                if (cols.length < 2) {
                    throw new IOException("Malformed line in " + path + ": " + line);
                }
                pairs.add(new double[]{Double.parseDouble(cols[0]), Double.parseDouble(cols[1])});
            }
        }
        if (pairs.isEmpty()) throw new IOException("Empty opacity table " + path);
        return InterpolationTable.of(pairs);
    }

    private static InputStream open(String path) throws IOException {
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) throw new IOException("Classpath resource not found: " + path);
        return resource.getInputStream();
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) throw new IllegalStateException("Receiver entry without " + field + ": " + node);
        return v.asText();
    }

    private static double requireDouble(JsonNode node, String field, String receiver) {
        JsonNode v = node.get(field);
        if (v == null || !v.isNumber()) {
            throw new IllegalStateException("Receiver " + receiver + ": missing numeric " + field);
        }
        return v.asDouble();
    }

    private static Double optionalDouble(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return (v == null || v.isNull()) ? null : v.asDouble();
    }
}
