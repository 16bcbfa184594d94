package com.labelcheck.backend.services.pdf;

import java.io.IOException;
import java.util.List;

public interface LabelDocument extends AutoCloseable {

    List<? extends LabelPage> pages();

    @Override
    void close() throws IOException;
}
