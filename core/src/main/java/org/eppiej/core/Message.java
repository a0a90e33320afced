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

package org.eppiej.core;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A mail message. The transport fields (addresses, date, subject, bodies) travel inside the encrypted payload; the
 * folder, read and flagged marks and the signature status are local state.
 */
public class Message {
    @Nullable private EmailAddress from;
    private List<EmailAddress> to = new ArrayList<>();
    private List<EmailAddress> cc = new ArrayList<>();
    private List<EmailAddress> bcc = new ArrayList<>();
    private Date date = new Date(0);
    private String subject = "";
    private String textBody = "";
    private String htmlBody = "";

    @Nullable private Folder folder;
    private boolean markedAsRead;
    private boolean flagged;
    private SignatureStatus signatureStatus = SignatureStatus.ABSENT;

    @Nullable
    public EmailAddress getFrom() {
        return from;
    }

    public void setFrom(@Nullable EmailAddress from) {
        this.from = from;
    }

    public List<EmailAddress> getTo() {
        return ImmutableList.copyOf(to);
    }

    public void setTo(List<EmailAddress> to) {
        this.to = new ArrayList<>(checkNotNull(to));
    }

    public void addTo(EmailAddress address) {
        to.add(checkNotNull(address));
    }

    public List<EmailAddress> getCc() {
        return ImmutableList.copyOf(cc);
    }

    public void setCc(List<EmailAddress> cc) {
        this.cc = new ArrayList<>(checkNotNull(cc));
    }

    public void addCc(EmailAddress address) {
        cc.add(checkNotNull(address));
    }

    public List<EmailAddress> getBcc() {
        return ImmutableList.copyOf(bcc);
    }

    public void setBcc(List<EmailAddress> bcc) {
        this.bcc = new ArrayList<>(checkNotNull(bcc));
    }

    public void addBcc(EmailAddress address) {
        bcc.add(checkNotNull(address));
    }

    /** To, Cc and Bcc in that order, each address once. */
    public List<EmailAddress> getAllRecipients() {
        Set<EmailAddress> all = new LinkedHashSet<>(to);
        all.addAll(cc);
        all.addAll(bcc);
        return ImmutableList.copyOf(all);
    }

    public Date getDate() {
        return new Date(date.getTime());
    }

    public void setDate(Date date) {
        this.date = new Date(checkNotNull(date).getTime());
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = checkNotNull(subject);
    }

    public String getTextBody() {
        return textBody;
    }

    public void setTextBody(String textBody) {
        this.textBody = checkNotNull(textBody);
    }

    public String getHtmlBody() {
        return htmlBody;
    }

    public void setHtmlBody(String htmlBody) {
        this.htmlBody = checkNotNull(htmlBody);
    }

    @Nullable
    public Folder getFolder() {
        return folder;
    }

    public void setFolder(@Nullable Folder folder) {
        this.folder = folder;
    }

    public boolean isMarkedAsRead() {
        return markedAsRead;
    }

    public void setMarkedAsRead(boolean markedAsRead) {
        this.markedAsRead = markedAsRead;
    }

    public boolean isFlagged() {
        return flagged;
    }

    public void setFlagged(boolean flagged) {
        this.flagged = flagged;
    }

    public SignatureStatus getSignatureStatus() {
        return signatureStatus;
    }

    public void setSignatureStatus(SignatureStatus signatureStatus) {
        this.signatureStatus = checkNotNull(signatureStatus);
    }

    public Message copy() {
        Message copy = fromJson(toJson());
        copy.folder = folder;
        copy.markedAsRead = markedAsRead;
        copy.flagged = flagged;
        copy.signatureStatus = signatureStatus;
        return copy;
    }

    /** Serializes the transport fields. */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        if (from != null)
            json.put("from", addressToJson(from));
        json.put("to", addressesToJson(to));
        if (!cc.isEmpty())
            json.put("cc", addressesToJson(cc));
        if (!bcc.isEmpty())
            json.put("bcc", addressesToJson(bcc));
        json.put("date", date.getTime());
        json.put("subject", subject);
        json.put("textBody", textBody);
        json.put("htmlBody", htmlBody);
        return json;
    }

    /**
     * @throws JSONException if a required field is missing or has the wrong type
     */
    public static Message fromJson(JSONObject json) throws JSONException {
        Message message = new Message();
        JSONObject from = json.optJSONObject("from");
        if (from != null)
            message.from = addressFromJson(from);
        addressesFromJson(json.getJSONArray("to"), message.to);
        JSONArray cc = json.optJSONArray("cc");
        if (cc != null)
            addressesFromJson(cc, message.cc);
        JSONArray bcc = json.optJSONArray("bcc");
        if (bcc != null)
            addressesFromJson(bcc, message.bcc);
        message.date = new Date(json.getLong("date"));
        message.subject = json.optString("subject", "");
        message.textBody = json.optString("textBody", "");
        message.htmlBody = json.optString("htmlBody", "");
        return message;
    }

    private static JSONArray addressesToJson(List<EmailAddress> addresses) {
        JSONArray json = new JSONArray();
        for (EmailAddress address : addresses)
            json.put(addressToJson(address));
        return json;
    }

    private static void addressesFromJson(JSONArray json, List<EmailAddress> into) {
        for (int i = 0; i < json.length(); i++)
            into.add(addressFromJson(json.getJSONObject(i)));
    }

    private static JSONObject addressToJson(EmailAddress address) {
        JSONObject json = new JSONObject();
        json.put("address", address.getAddress());
        if (address.getName() != null)
            json.put("name", address.getName());
        return json;
    }

    private static EmailAddress addressFromJson(JSONObject json) {
        return new EmailAddress(json.getString("address"), json.optString("name", null));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("from", from == null ? null : from.getAddress())
                .add("to", to.size())
                .add("cc", cc.size())
                .add("bcc", bcc.size())
                .add("date", date)
                .add("subject", subject)
                .add("folder", folder)
                .toString();
    }
}
