package com.payment.gateway.api;

import com.payment.gateway.capability.BarcodePaymentService;
import com.payment.gateway.capability.BillDownloadService;
import com.payment.gateway.capability.PagePaymentService;
import com.payment.gateway.capability.ScanPaymentService;
import com.payment.gateway.capability.TradeService;
import com.payment.gateway.domain.BarcodePaymentResult;
import com.payment.gateway.domain.BillFile;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for payment initiation and trade lifecycle operations.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Initiate Alipay payments and manage existing trades")
public class PaymentController {

    private final PagePaymentService pagePaymentService;
    private final ScanPaymentService scanPaymentService;
    private final BarcodePaymentService barcodePaymentService;
    private final TradeService tradeService;
    private final BillDownloadService billDownloadService;

    @PostMapping("/form")
    @Operation(summary = "Desktop web payment",
            description = "Returns an auto-submitting HTML form that posts the signed order to the gateway.")
    public ResponseEntity<PaymentInitiationResponseDto> form(@Valid @RequestBody OrderRequestDto dto) {
        return initiated(dto, "FORM", pagePaymentService.buildFormPayment(dto.toOrder()));
    }

    @PostMapping("/url")
    @Operation(summary = "Mobile web payment", description = "Returns the gateway URL to redirect the buyer to.")
    public ResponseEntity<PaymentInitiationResponseDto> url(@Valid @RequestBody OrderRequestDto dto) {
        return initiated(dto, "URL", pagePaymentService.buildUrlPayment(dto.toOrder()));
    }

    @PostMapping("/app")
    @Operation(summary = "In-app payment", description = "Returns the signed order string for the mobile SDK.")
    public ResponseEntity<PaymentInitiationResponseDto> app(@Valid @RequestBody OrderRequestDto dto) {
        return initiated(dto, "APP", pagePaymentService.buildAppPayment(dto.toOrder()));
    }

    @PostMapping("/applet")
    @Operation(summary = "Mini-program payment", description = "Returns the signed order string for the mini-program.")
    public ResponseEntity<PaymentInitiationResponseDto> applet(@Valid @RequestBody OrderRequestDto dto) {
        return initiated(dto, "APPLET", pagePaymentService.buildAppletPayment(dto.toOrder()));
    }

    @PostMapping("/scan")
    @Operation(summary = "QR code payment", description = "Pre-creates the trade and returns the QR code content for the buyer to scan.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "QR code created",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentInitiationResponseDto.class))),
            @ApiResponse(responseCode = "502", description = "Provider rejected the order. Body: { \"error\": \"GATEWAY_OPERATION_FAILED\", \"code\", \"subCode\", \"message\" }")
    })
    public ResponseEntity<PaymentInitiationResponseDto> scan(@Valid @RequestBody OrderRequestDto dto) {
        return initiated(dto, "SCAN", scanPaymentService.buildScanPayment(dto.toOrder()));
    }

    @PostMapping("/barcode")
    @Operation(summary = "Barcode payment",
            description = "Charges the buyer's payment code. When the buyer has to confirm, the trade is polled "
                    + "and cancelled if it is not paid in time. Check body.outcome: SUCCEEDED, FAILED or TIMED_OUT.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment finished with the outcome in the body",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = BarcodePaymentResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed. Body: { \"error\": \"VALIDATION_FAILED\", ... }")
    })
    public ResponseEntity<BarcodePaymentResponseDto> barcode(@Valid @RequestBody OrderRequestDto dto) {
        if (dto.getAuthCode() == null || dto.getAuthCode().isBlank()) {
            throw new IllegalArgumentException("authCode is required for barcode payments");
        }
        BarcodePaymentResult result = barcodePaymentService.pay(dto.toOrder());
        return ResponseEntity.ok(BarcodePaymentResponseDto.from(result));
    }

    @PostMapping("/query")
    @Operation(summary = "Query a trade")
    public ResponseEntity<TradeResponseDto> query(@RequestBody AuxiliaryRequestDto dto) {
        return ResponseEntity.ok(TradeResponseDto.from(tradeService.query(dto.toAuxiliary())));
    }

    @PostMapping("/cancel")
    @Operation(summary = "Cancel a trade", description = "Closes an unpaid trade or refunds a paid one. body.action tells which.")
    public ResponseEntity<TradeResponseDto> cancel(@RequestBody AuxiliaryRequestDto dto) {
        return ResponseEntity.ok(TradeResponseDto.from(tradeService.cancel(dto.toAuxiliary())));
    }

    @PostMapping("/close")
    @Operation(summary = "Close an unpaid trade")
    public ResponseEntity<TradeResponseDto> close(@RequestBody AuxiliaryRequestDto dto) {
        return ResponseEntity.ok(TradeResponseDto.from(tradeService.close(dto.toAuxiliary())));
    }

    @PostMapping("/refund")
    @Operation(summary = "Refund a trade", description = "Full or partial refund. Use outRequestNo to tell partial refunds apart.")
    public ResponseEntity<TradeResponseDto> refund(@RequestBody AuxiliaryRequestDto dto) {
        return ResponseEntity.ok(TradeResponseDto.from(tradeService.refund(dto.toAuxiliary())));
    }

    @PostMapping("/refund-query")
    @Operation(summary = "Query a refund")
    public ResponseEntity<TradeResponseDto> refundQuery(@RequestBody AuxiliaryRequestDto dto) {
        return ResponseEntity.ok(TradeResponseDto.from(tradeService.refundQuery(dto.toAuxiliary())));
    }

    @PostMapping("/bill-url")
    @Operation(summary = "Statement download URL", description = "Returns the short-lived URL of a daily or monthly statement.")
    public ResponseEntity<Map<String, String>> billUrl(@RequestBody AuxiliaryRequestDto dto) {
        return ResponseEntity.ok(Map.of("billDownloadUrl", billDownloadService.queryBillDownloadUrl(dto.toAuxiliary())));
    }

    @PostMapping("/bill")
    @Operation(summary = "Download a statement", description = "Streams the statement archive as an attachment.")
    public ResponseEntity<byte[]> bill(@RequestBody AuxiliaryRequestDto dto) {
        BillFile file = billDownloadService.downloadBill(dto.toAuxiliary());
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(file.getFileName()).build().toString())
                .body(file.getContent());
    }

    private static ResponseEntity<PaymentInitiationResponseDto> initiated(OrderRequestDto dto, String mode, String payload) {
        log.debug("Payment initiated: outTradeNo={}, mode={}", dto.getOutTradeNo(), mode);
        return ResponseEntity.ok(PaymentInitiationResponseDto.builder()
                .outTradeNo(dto.getOutTradeNo())
                .mode(mode)
                .payload(payload)
                .build());
    }
}
