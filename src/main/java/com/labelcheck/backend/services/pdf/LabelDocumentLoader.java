package com.labelcheck.backend.services.pdf;

import java.io.IOException;

@FunctionalInterface
public interface LabelDocumentLoader {

    LabelDocument load(byte[] pdfBytes) throws IOException;
}
