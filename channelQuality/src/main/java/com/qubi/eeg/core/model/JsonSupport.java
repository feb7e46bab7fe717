package com.qubi.eeg.core.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.qubi.eeg.core.error.QualityAnalysisException;

/** Serialización de reportes hacia los colaboradores externos (PDF, dashboard). */
public final class JsonSupport {
    private JsonSupport(){}
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

    public static String toJson(Object o){
        try { return MAPPER.writeValueAsString(o); }
        catch (JsonProcessingException e){ throw new QualityAnalysisException("Cannot serialize " + o.getClass().getSimpleName(), e); }
    }
    public static byte[] toBytes(Object o){
        try { return MAPPER.writeValueAsBytes(o); }
        catch (JsonProcessingException e){ throw new QualityAnalysisException("Cannot serialize " + o.getClass().getSimpleName(), e); }
    }
}
