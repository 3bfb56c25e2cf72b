package com.bomengine.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProductionRequest {
    Product product;
    int quantity;
}
