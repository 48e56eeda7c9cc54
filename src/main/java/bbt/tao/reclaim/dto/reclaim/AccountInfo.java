package bbt.tao.reclaim.dto.reclaim;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

public record AccountInfo(
        String timeZone,
        AccountDefaults defaults,
        JsonNode rawDefaults
) {
    public static final AccountInfo EMPTY = new AccountInfo(null, AccountDefaults.NONE, NullNode.getInstance());
}
