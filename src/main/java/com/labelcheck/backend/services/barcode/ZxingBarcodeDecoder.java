package com.labelcheck.backend.services.barcode;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.multi.GenericMultipleBarcodeReader;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ZxingBarcodeDecoder implements BarcodeDecoder {

    private static final Map<DecodeHintType, Object> HINTS = new EnumMap<>(DecodeHintType.class);

    static {
        HINTS.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
        HINTS.put(DecodeHintType.POSSIBLE_FORMATS, List.of(
                BarcodeFormat.UPC_A,
                BarcodeFormat.EAN_13,
                BarcodeFormat.CODE_128,
                BarcodeFormat.QR_CODE,
                BarcodeFormat.DATA_MATRIX));
    }

    @Override
    public List<String> decode(BufferedImage image) {
        if (image == null) return List.of();

        BinaryBitmap bitmap = new BinaryBitmap(new HybridBinarizer(new BufferedImageLuminanceSource(image)));
        GenericMultipleBarcodeReader reader = new GenericMultipleBarcodeReader(new MultiFormatReader());

        Result[] results;
        try {
            results = reader.decodeMultiple(bitmap, HINTS);
        } catch (NotFoundException e) {
            return List.of();
        }

        List<String> values = new ArrayList<>();
        for (Result result : results) {
            String text = result.getText();
            if (text != null && !text.isBlank()) {
                values.add(text.trim());
            }
        }
        log.debug("[Barcode] Decoded {} value(s)", values.size());
        return values;
    }
}
