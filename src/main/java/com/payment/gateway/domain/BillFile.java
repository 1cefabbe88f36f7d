package com.payment.gateway.domain;

import lombok.Value;

/**
 * A downloaded statement archive. Storing it is up to the caller.
 */
@Value
public class BillFile {

    String fileName;
    String downloadUrl;
    byte[] content;
}
