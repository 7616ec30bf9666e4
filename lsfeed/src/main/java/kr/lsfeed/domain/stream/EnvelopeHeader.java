package kr.lsfeed.domain.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope header. Requests carry token/tr_type/tr_cd; responses may add rsp_cd/rsp_msg.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnvelopeHeader(
    @JsonProperty("token") String token,
    @JsonProperty("tr_type") String trType,
    @JsonProperty("tr_cd") String trCd,
    @JsonProperty("tr_key") String trKey,
    @JsonProperty("rsp_cd") String rspCd,
    @JsonProperty("rsp_msg") String rspMsg
) {
    public static EnvelopeHeader request(String token, String trType, String trCd) {
        return new EnvelopeHeader(token, trType, trCd, null, null, null);
    }

    public EnvelopeHeader withToken(String newToken) {
        return new EnvelopeHeader(newToken, trType, trCd, trKey, rspCd, rspMsg);
    }

    public EnvelopeHeader withTrType(String newTrType) {
        return new EnvelopeHeader(token, newTrType, trCd, trKey, rspCd, rspMsg);
    }
}
