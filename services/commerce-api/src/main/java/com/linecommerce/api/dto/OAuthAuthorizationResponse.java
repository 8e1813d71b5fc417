package com.linecommerce.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where to send the browser to start an OAuth sign-in, plus the state value
 * the provider will echo back on the callback.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OAuthAuthorizationResponse {

    private String authorizationUrl;

    private String state;
}
