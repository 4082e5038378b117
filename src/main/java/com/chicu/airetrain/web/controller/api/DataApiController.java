package com.chicu.airetrain.web.controller.api;

import com.chicu.airetrain.ml.dataset.InMemoryWindowDataSource;
import com.chicu.airetrain.ml.dataset.LabeledRow;
import com.chicu.airetrain.web.dto.DataRowsDto;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping(value = "/api/data", produces = MediaType.APPLICATION_JSON_VALUE)
public class DataApiController {

    private final InMemoryWindowDataSource window;

    @PostMapping("/rows")
    public Map<String, Object> append(@Valid @RequestBody DataRowsDto body) {
        if (body.featureNames() != null && !body.featureNames().isEmpty()) {
            window.setFeatureNames(body.featureNames());
        }

        List<LabeledRow> rows = body.rows().stream()
                .map(r -> r == null ? null : new LabeledRow(r.features(), r.label()))
                .toList();
        int accepted = window.append(rows);

        Map<String, Object> out = new HashMap<>();
        out.put("received", rows.size());
        out.put("accepted", accepted);
        out.put("windowSize", window.size());
        return out;
    }
}
