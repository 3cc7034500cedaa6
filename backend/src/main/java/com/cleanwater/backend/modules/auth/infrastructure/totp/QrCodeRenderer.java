package com.cleanwater.backend.modules.auth.infrastructure.totp;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Map;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;

import org.springframework.stereotype.Component;

/**
 * Renders a provisioning URI as a PNG QR code wrapped in a {@code data:} URI.
 */
@Component
public class QrCodeRenderer {

    private static final String DATA_URI_PREFIX = "data:image/png;base64,";
    private static final int SIZE_PX = 290;
    private static final int QUIET_ZONE_MODULES = 5;

    public String renderDataUri(String content) {
        try {
            BitMatrix matrix = new QRCodeWriter().encode(
                    content,
                    BarcodeFormat.QR_CODE,
                    SIZE_PX,
                    SIZE_PX,
                    Map.of(EncodeHintType.MARGIN, QUIET_ZONE_MODULES)
            );
            ByteArrayOutputStream png = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, "PNG", png);
            return DATA_URI_PREFIX + Base64.getEncoder().encodeToString(png.toByteArray());
        } catch (WriterException | IOException ex) {
            throw new IllegalStateException("Failed to render QR code", ex);
        }
    }
}
