/*
 * Copyright 2024 the eppiej developers
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eppiej.mailbox;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.SignatureDecodeException;
import org.bouncycastle.util.encoders.Base64;
import org.eppiej.core.Account;
import org.eppiej.core.Message;
import org.eppiej.core.SignatureStatus;
import org.eppiej.keys.KeyResolution;
import org.eppiej.keys.PublicKeyService;
import org.eppiej.utils.CancellationSignal;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.CancellationException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>{@link MessageProtector} for decentralized mail. The signed form is a JSON envelope:</p>
 *
 * <pre>{"v":1, "message":"&lt;message json&gt;", "signer":"&lt;key address&gt;", "signature":"&lt;base64 DER&gt;"}</pre>
 *
 * <p>The signature is an ECDSA signature over SHA-256 of the UTF-8 message JSON, made with the key the sender
 * account derives. On receipt it only counts as verified when the sender address resolves to the signer key.</p>
 */
public class DecMessageProtector implements MessageProtector {
    private static final Logger log = LoggerFactory.getLogger(DecMessageProtector.class);

    public static final int ENVELOPE_VERSION = 1;

    private final KeyStorage keyStorage;
    private final PublicKeyService publicKeyService;
    private final DecProtector protector;

    public DecMessageProtector(KeyStorage keyStorage, PublicKeyService publicKeyService, DecProtector protector) {
        this.keyStorage = checkNotNull(keyStorage, "keyStorage");
        this.publicKeyService = checkNotNull(publicKeyService, "publicKeyService");
        this.protector = checkNotNull(protector, "protector");
    }

    @Override
    public ListenableFuture<byte[]> sign(Account sender, Message message, CancellationSignal signal) {
        checkNotNull(sender, "sender");
        checkNotNull(message, "message");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        String messageJson = message.toJson().toString();
        return Futures.transform(keyStorage.getMasterKey(signal), masterKey -> {
            ECKey key = publicKeyService.derivePrivateKey(masterKey, sender.getDerivationPath());
            byte[] signature = key.sign(hash(messageJson)).encodeToDER();
            JSONObject envelope = new JSONObject();
            envelope.put("v", ENVELOPE_VERSION);
            envelope.put("message", messageJson);
            envelope.put("signer", publicKeyService.encode(key));
            envelope.put("signature", Base64.toBase64String(signature));
            return envelope.toString().getBytes(StandardCharsets.UTF_8);
        }, MoreExecutors.directExecutor());
    }

    @Override
    public ListenableFuture<byte[]> signAndEncrypt(Account sender, String recipientPublicKeyAddress, Message message,
                                                   CancellationSignal signal) {
        checkNotNull(recipientPublicKeyAddress, "recipientPublicKeyAddress");
        return Futures.transform(sign(sender, message, signal),
                signed -> protector.encrypt(recipientPublicKeyAddress, signed), MoreExecutors.directExecutor());
    }

    @Override
    public ListenableFuture<Message> tryVerifyAndDecrypt(Account recipient, byte[] data, CancellationSignal signal) {
        checkNotNull(recipient, "recipient");
        checkNotNull(data, "data");
        return Futures.transformAsync(protector.decrypt(recipient, data, signal), plain -> {
            JSONObject envelope;
            Message message;
            String messageJson;
            try {
                envelope = new JSONObject(new String(plain, StandardCharsets.UTF_8));
                if (envelope.optInt("v", -1) != ENVELOPE_VERSION)
                    throw new MessageProtectionException("Unknown envelope version " + envelope.opt("v"));
                messageJson = envelope.getString("message");
                message = Message.fromJson(new JSONObject(messageJson));
            } catch (JSONException e) {
                throw new MessageProtectionException("Malformed message envelope", e);
            }
            String signer = envelope.optString("signer", "");
            String signature = envelope.optString("signature", "");
            Message result = message;
            if (signer.isEmpty() || signature.isEmpty()) {
                result.setSignatureStatus(SignatureStatus.ABSENT);
                return Futures.immediateFuture(result);
            }
            return Futures.transform(verify(result, messageJson, signer, signature, signal), status -> {
                result.setSignatureStatus(status);
                return result;
            }, MoreExecutors.directExecutor());
        }, MoreExecutors.directExecutor());
    }

    private ListenableFuture<SignatureStatus> verify(Message message, String messageJson, String signer,
                                                     String signature, CancellationSignal signal) {
        byte[] signerKey;
        try {
            signerKey = publicKeyService.decode(signer).getPubKey();
            ECKey.ECDSASignature decoded = ECKey.ECDSASignature.decodeFromDER(Base64.decode(signature));
            if (!ECKey.verify(hash(messageJson).getBytes(), decoded, signerKey)) {
                log.warn("Bad signature on message from {}", message.getFrom());
                return Futures.immediateFuture(SignatureStatus.UNVERIFIED);
            }
        } catch (SignatureDecodeException | RuntimeException e) {
            log.warn("Unreadable signature on message from {}: {}", message.getFrom(), e.toString());
            return Futures.immediateFuture(SignatureStatus.UNVERIFIED);
        }
        if (message.getFrom() == null)
            return Futures.immediateFuture(SignatureStatus.UNVERIFIED);

        ListenableFuture<KeyResolution> resolution;
        try {
            resolution = publicKeyService.resolve(message.getFrom(), signal);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Cannot resolve sender {}: {}", message.getFrom(), e.toString());
            return Futures.immediateFuture(SignatureStatus.UNVERIFIED);
        }
        ListenableFuture<SignatureStatus> status = Futures.transform(resolution, result -> {
            if (result.isFound() && Arrays.equals(publicKeyService.decode(result.getPublicKeyAddress()).getPubKey(), signerKey))
                return SignatureStatus.VERIFIED;
            log.warn("Message signer does not match the key of sender {}", message.getFrom());
            return SignatureStatus.UNVERIFIED;
        }, MoreExecutors.directExecutor());
        return Futures.catching(status, Exception.class, e -> {
            if (e instanceof CancellationException)
                throw (CancellationException) e;
            log.warn("Sender key lookup failed for {}: {}", message.getFrom(), e.toString());
            return SignatureStatus.UNVERIFIED;
        }, MoreExecutors.directExecutor());
    }

    private static Sha256Hash hash(String messageJson) {
        return Sha256Hash.of(messageJson.getBytes(StandardCharsets.UTF_8));
    }
}
