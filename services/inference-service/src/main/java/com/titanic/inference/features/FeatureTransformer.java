package com.titanic.inference.features;

import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class FeatureTransformer {
    private final FeatureSchemaService schemaService;

    public FeatureTransformer(FeatureSchemaService schemaService) {
        this.schemaService = schemaService;
    }

    public FeatureVector transform(PassengerFeatures features) {
        return transform(features, schemaService.getSchema());
    }

    public static FeatureVector transform(PassengerFeatures features, FeatureSchema schema) {
        if (schema == null) {
            throw new TransformException("feature schema not loaded");
        }
        PreprocessingStats stats = schema.stats();
        LabelEncodings encodings = schema.encodings();

        double age = features.age() != null ? features.age() : stats.getAgeMedian();
        double fare = features.fare() != null ? features.fare() : stats.getFareMedian();
        Embarked embarked = features.embarked() != null
            ? features.embarked()
            : Embarked.from(stats.getEmbarkedMode());
        if (embarked == null) {
            throw new TransformException("embarked could not be imputed");
        }
        int sexCode = encodings.encodeSex(features.sex());
        int embarkedCode = encodings.encodeEmbarked(embarked);
        if (sexCode < 0 || embarkedCode < 0) {
            throw new TransformException("categorical value missing from label encoder");
        }
        int familySize = features.familySize();

        List<FeatureColumn> columns = schema.manifest().columns();
        double[] values = new double[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            values[i] = switch (columns.get(i)) {
                case PCLASS -> features.pclass();
                case SEX -> sexCode;
                case AGE -> age;
                case SIBSP -> features.sibsp();
                case PARCH -> features.parch();
                case FARE -> fare;
                case EMBARKED -> embarkedCode;
                case FAMILY_SIZE -> familySize;
                case IS_ALONE -> familySize == 1 ? 1.0 : 0.0;
                case AGE_GROUP -> ageGroup(age);
            };
            if (!Double.isFinite(values[i])) {
                throw new TransformException("non-finite value for column " + columns.get(i).columnName());
            }
        }
        return new FeatureVector(schema.manifest().names(), values);
    }

    static int ageGroup(double age) {
        if (age < 18) {
            return 0;
        }
        if (age < 35) {
            return 1;
        }
        if (age < 60) {
            return 2;
        }
        return 3;
    }
}
