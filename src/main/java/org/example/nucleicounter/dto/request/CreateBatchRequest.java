package org.example.nucleicounter.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.example.nucleicounter.model.RunMode;

import java.util.List;

@Getter
@Setter
public class CreateBatchRequest {

    @NotNull(message = "images must be provided (it may be empty)")
    private List<String> images;

    private RunMode runMode = RunMode.HEADLESS;

    public CreateBatchRequest() {
    }

    public CreateBatchRequest(List<String> images, RunMode runMode) {
        this.images = images;
        this.runMode = runMode;
    }
}
