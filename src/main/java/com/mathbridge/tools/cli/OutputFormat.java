// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.tools.cli;

import com.amazon.ion.IonWriter;
import com.amazon.ion.system.IonTextWriterBuilder;
import java.io.OutputStream;

/**
 * Represents the MathJSON output formats supported by {@link MathBridgeCli}.
 */
public enum OutputFormat {
    /** Compact JSON, one value per line */      JSON,
    /** Indented JSON */                          PRETTY,
    /** Ion text, one value per line */           ION;

    IonWriter createIonWriter(OutputStream outputStream) {
        switch (this) {
            case JSON: return IonTextWriterBuilder.json()
                    .withWriteTopLevelValuesOnNewLines(true)
                    .build(outputStream);
            case PRETTY: return IonTextWriterBuilder.json()
                    .withPrettyPrinting()
                    .build(outputStream);
            case ION: return IonTextWriterBuilder.standard()
                    .withWriteTopLevelValuesOnNewLines(true)
                    .build(outputStream);
            default: throw new IllegalStateException("Unsupported output format: " + this);
        }
    }
}
