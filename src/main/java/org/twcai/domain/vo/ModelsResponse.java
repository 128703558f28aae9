package org.twcai.domain.vo;

import lombok.Data;

import java.util.List;

@Data
public class ModelsResponse {
    private String object;
    private List<Model> data;
}
