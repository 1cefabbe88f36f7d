package com.payment.gateway.capability;

import com.payment.gateway.core.AuxiliaryValidator;
import com.payment.gateway.core.CommitCycle;
import com.payment.gateway.core.GatewayData;
import com.payment.gateway.core.GatewayMethod;
import com.payment.gateway.core.GatewayTransport;
import com.payment.gateway.core.MalformedResponseException;
import com.payment.gateway.domain.Auxiliary;
import com.payment.gateway.domain.AuxiliaryType;
import com.payment.gateway.domain.BillFile;
import com.payment.gateway.domain.Notify;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Statement download: asks the provider for a short-lived download URL, then fetches the archive.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BillDownloadService {

    private static final DateTimeFormatter FILE_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final String FILE_TYPE = "fileType";
    private static final String DEFAULT_FILE_TYPE = "csv.zip";

    private final CommitCycle commitCycle;
    private final AuxiliaryValidator validator;
    private final GatewayTransport transport;
    private final Clock clock;

    public String queryBillDownloadUrl(Auxiliary auxiliary) {
        validator.validate(auxiliary, AuxiliaryType.BILL_DOWNLOAD);
        Notify notify = commitCycle.commit(GatewayMethod.BILL_DOWNLOAD, auxiliary);
        if (notify.getBillDownloadUrl() == null || notify.getBillDownloadUrl().isBlank()) {
            throw new MalformedResponseException("Bill download response carries no bill_download_url");
        }
        return notify.getBillDownloadUrl();
    }

    public BillFile downloadBill(Auxiliary auxiliary) {
        String url = queryBillDownloadUrl(auxiliary);
        String fileType = new GatewayData().fromUrl(url).getString(FILE_TYPE);
        String fileName = LocalDateTime.now(clock).format(FILE_NAME_FORMAT) + "." + (fileType != null ? fileType : DEFAULT_FILE_TYPE);

        byte[] content = transport.download(url);
        log.info("Downloaded bill: billType={}, billDate={}, fileName={}, bytes={}",
                auxiliary.getBillType(), auxiliary.getBillDate(), fileName, content.length);
        return new BillFile(fileName, url, content);
    }
}
