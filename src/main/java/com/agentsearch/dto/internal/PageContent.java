package com.agentsearch.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageContent {

    private String url;

    private String title;

    private String content;

    private String contentType;

    private boolean success;
}
