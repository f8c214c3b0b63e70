package com.titanic.inference.api;

import com.titanic.inference.api.dto.ModelInfoResponse;
import com.titanic.inference.common.RequestContext;
import com.titanic.inference.common.RequestContextHolder;
import com.titanic.inference.features.FeatureSchemaService;
import com.titanic.inference.model.ModelCache;
import com.titanic.inference.model.ModelCatalog;
import com.titanic.inference.model.ModelMetadata;
import com.titanic.inference.model.ModelStatus;
import java.util.ArrayList;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ModelInfoController {
    private final ModelCatalog catalog;
    private final ModelCache modelCache;
    private final FeatureSchemaService schemaService;

    public ModelInfoController(ModelCatalog catalog, ModelCache modelCache, FeatureSchemaService schemaService) {
        this.catalog = catalog;
        this.modelCache = modelCache;
        this.schemaService = schemaService;
    }

    @GetMapping("/models/info")
    public ModelInfoResponse info() {
        List<ModelInfoResponse.ModelInfo> models = new ArrayList<>();
        int loaded = 0;
        for (String key : catalog.keys()) {
            ModelMetadata metadata = catalog.metadata(key);
            ModelStatus status = modelCache.status(key);
            if (status == ModelStatus.LOADED) {
                loaded++;
            }
            ModelInfoResponse.ModelInfo info = new ModelInfoResponse.ModelInfo();
            info.setName(key);
            info.setType(metadata.type().wire());
            info.setArtifact(metadata.artifact());
            info.setStatus(status.wire());
            info.setAccuracy(metadata.accuracy());
            info.setTrainingDate(metadata.trainingDate());
            models.add(info);
        }

        ModelInfoResponse response = new ModelInfoResponse();
        response.setModels(models);
        response.setModelsLoaded(loaded);
        response.setEnsembleAccuracy(catalog.ensembleAccuracy());
        response.setFeatureColumns(schemaService.getSchema().manifest().names());
        response.setLoadingMode("lazy");
        RequestContext context = RequestContextHolder.get();
        if (context != null) {
            response.setTraceId(context.getTraceId());
            response.setRequestId(context.getRequestId());
        }
        return response;
    }
}
