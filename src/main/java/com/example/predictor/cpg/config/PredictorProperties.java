package com.example.predictor.cpg.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "predictor")
@Validated
public class PredictorProperties {

    public static final String DEFAULT_NAME = "CpG Predictor";

    @NotBlank
    private String name = DEFAULT_NAME;

    @NotEmpty
    private final List<String> supportedRequestFormats =
            new ArrayList<>(List.of("application/json", "application/msgpack"));

    // JSON is always served even when not listed; this only gates msgpack.
    private final List<String> supportedResponseFormats =
            new ArrayList<>(List.of("application/json", "application/msgpack"));

    @NotBlank
    private String helpFile = "classpath:predictor_help_message.json";

    @Positive
    private int trackWindowSize = 50;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getSupportedRequestFormats() {
        return supportedRequestFormats;
    }

    public void setSupportedRequestFormats(List<String> formats) {
        replaceLowerCased(this.supportedRequestFormats, formats);
    }

    public List<String> getSupportedResponseFormats() {
        return supportedResponseFormats;
    }

    public void setSupportedResponseFormats(List<String> formats) {
        replaceLowerCased(this.supportedResponseFormats, formats);
    }

    public String getHelpFile() {
        return helpFile;
    }

    public void setHelpFile(String helpFile) {
        this.helpFile = helpFile;
    }

    public int getTrackWindowSize() {
        return trackWindowSize;
    }

    public void setTrackWindowSize(int trackWindowSize) {
        this.trackWindowSize = trackWindowSize;
    }

    private static void replaceLowerCased(List<String> target, List<String> source) {
        target.clear();
        if (source != null) {
            source.stream()
                    .map(fmt -> fmt.trim().toLowerCase(Locale.ROOT))
                    .forEach(target::add);
        }
    }
}
