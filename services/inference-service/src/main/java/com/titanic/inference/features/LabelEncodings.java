package com.titanic.inference.features;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Sorted class lists per categorical column; a value's code is its index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LabelEncodings {
    private List<String> sex = List.of("female", "male");
    private List<String> embarked = List.of("C", "Q", "S");

    public static LabelEncodings defaults() {
        return new LabelEncodings();
    }

    public List<String> getSex() {
        return sex;
    }

    public void setSex(List<String> sex) {
        this.sex = sex;
    }

    public List<String> getEmbarked() {
        return embarked;
    }

    public void setEmbarked(List<String> embarked) {
        this.embarked = embarked;
    }

    public int encodeSex(Sex value) {
        return sex.indexOf(value.wire());
    }

    public int encodeEmbarked(Embarked value) {
        return embarked.indexOf(value.wire());
    }
}
