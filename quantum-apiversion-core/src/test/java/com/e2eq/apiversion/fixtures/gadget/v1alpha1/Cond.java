package com.e2eq.apiversion.fixtures.gadget.v1alpha1;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Same name as the hub type; severity is text here. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Cond {
    private String type;
    private String severity;
}
