package com.reportwheel.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class MailMessage {

    private final List<String> to;

    private final List<String> cc;

    private final String subject;

    private final String body;

    private final String attachmentName;

    private final String attachmentContentType;

    private final byte[] attachment;
}
