package de.bsommerfeld.fdf.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration of the FDF toolkit, read from a TOML file with one table
 * per section. Missing keys keep their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FdfConfig {

    @JsonProperty("layout")
    private LayoutConfig layout = new LayoutConfig();

    @JsonProperty("export")
    private ExportConfig export = new ExportConfig();

    public LayoutConfig getLayout() {
        return layout;
    }

    public void setLayout(LayoutConfig layout) {
        this.layout = layout;
    }

    public ExportConfig getExport() {
        return export;
    }

    public void setExport(ExportConfig export) {
        this.export = export;
    }
}
