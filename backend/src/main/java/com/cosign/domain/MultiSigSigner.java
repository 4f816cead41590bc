package com.cosign.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Signer of a multi-sig wallet. Address is stored normalized; (walletId, address) is unique.
 */
@Document(collection = "multisig_signers")
@CompoundIndex(name = "wallet_address", def = "{'walletId': 1, 'address': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MultiSigSigner {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String walletId;
    private String address;
    private String name;
    private String email;
    private Instant addedAt;
}
