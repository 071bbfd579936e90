package com.mass.simulator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Manually triggered alarm.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlarmTrigger {

    public static final String DEFAULT_ALARM_TYPE = "alarm";
    public static final String DEFAULT_LEVEL = "warning";
    public static final String DEFAULT_METER_BRAND = "Unknown";

    @JsonProperty("alarm_type")
    private String alarmType = DEFAULT_ALARM_TYPE;
    @JsonProperty("level")
    private String level = DEFAULT_LEVEL;
    @JsonProperty("incident_code")
    private Integer incidentCode;
    @JsonProperty("description")
    private String description;
    @JsonProperty("meter_serial")
    private String meterSerial;
    @JsonProperty("meter_brand")
    private String meterBrand = DEFAULT_METER_BRAND;

    public String getAlarmType() {
        return alarmType;
    }

    public void setAlarmType(String alarmType) {
        this.alarmType = alarmType;
    }

    public String getLevel() {
        return level;
    }

    public void setLevel(String level) {
        this.level = level;
    }

    public Integer getIncidentCode() {
        return incidentCode;
    }

    public void setIncidentCode(Integer incidentCode) {
        this.incidentCode = incidentCode;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getMeterSerial() {
        return meterSerial;
    }

    public void setMeterSerial(String meterSerial) {
        this.meterSerial = meterSerial;
    }

    public String getMeterBrand() {
        return meterBrand;
    }

    public void setMeterBrand(String meterBrand) {
        this.meterBrand = meterBrand;
    }
}
