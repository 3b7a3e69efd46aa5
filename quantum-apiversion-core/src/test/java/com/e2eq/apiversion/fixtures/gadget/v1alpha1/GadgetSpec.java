package com.e2eq.apiversion.fixtures.gadget.v1alpha1;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class GadgetSpec {
    private String name;
    private Cond cond;
}
