package com.warelay.whatsapprelay.outbound;

import com.warelay.whatsapprelay.model.MessageRequest;
import com.warelay.whatsapprelay.model.MessageRequest.ContactRequest;
import com.warelay.whatsapprelay.model.MessageRequest.LocationRequest;
import com.warelay.whatsapprelay.model.MessageRequest.MediaRequest;
import com.warelay.whatsapprelay.model.MessageRequest.PollRequest;
import com.warelay.whatsapprelay.transport.content.ContactContent;
import com.warelay.whatsapprelay.transport.content.LocationContent;
import com.warelay.whatsapprelay.transport.content.MediaContent;
import com.warelay.whatsapprelay.transport.content.MediaKind;
import com.warelay.whatsapprelay.transport.content.MessageContent;
import com.warelay.whatsapprelay.transport.content.PollContent;
import com.warelay.whatsapprelay.transport.content.TextContent;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Maps an API message request to the content object the transport sends. */
@Component
public class OutboundContentFactory {

  /**
   * Picks media, location, poll or contact, in that order, falling back to text.
   *
   * <p>A media entry without kind or data is ignored and the text is used instead, matching the
   * request shape clients already send. Returns empty when nothing sendable remains.
   *
   * @throws IllegalArgumentException if the media payload is not valid base64
   */
  public Optional<MessageContent> build(MessageRequest request) {
    if (request.media() != null) {
      Optional<MessageContent> media = media(request.media());
      return media.isPresent() ? media : text(request.text());
    }
    if (request.location() != null) {
      return Optional.of(location(request.location()));
    }
    if (request.poll() != null) {
      return Optional.of(poll(request.poll()));
    }
    if (request.contact() != null) {
      return Optional.of(contact(request.contact()));
    }
    return text(request.text());
  }

  private static Optional<MessageContent> text(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new TextContent(text));
  }

  private static Optional<MessageContent> media(MediaRequest media) {
    MediaKind kind = MediaKind.fromCode(media.type());
    String data = media.data() == null ? "" : media.data().replaceAll("\\s", "");
    if (kind == null || data.isEmpty()) {
      return Optional.empty();
    }
    byte[] bytes = Base64.getDecoder().decode(data);
    return Optional.of(
        new MediaContent(
            kind,
            bytes,
            emptyToNull(media.caption()),
            emptyToNull(media.mimetype()),
            emptyToNull(media.filename()),
            media.ptt(),
            media.gifPlayback()));
  }

  private static LocationContent location(LocationRequest location) {
    return new LocationContent(
        location.name(),
        location.address(),
        location.url(),
        location.latitude(),
        location.longitude());
  }

  /** Multi-select polls allow any number of answers (0); single-select polls allow one. */
  private static PollContent poll(PollRequest poll) {
    List<String> values = poll.options() == null ? List.of() : List.copyOf(poll.options());
    int selectable = Boolean.FALSE.equals(poll.allowMultipleAnswers()) ? 1 : 0;
    return new PollContent(poll.name(), values, selectable);
  }

  private static ContactContent contact(ContactRequest contact) {
    String firstname = nullToEmpty(contact.firstname());
    String lastname = nullToEmpty(contact.lastname());
    String displayName = firstname + " " + lastname;
    return new ContactContent(
        displayName, List.of(vcard(displayName, contact.email(), contact.phone())));
  }

  static String vcard(String displayName, String email, String phone) {
    String number = nullToEmpty(phone).replace(" ", "").replace("+", "");
    return "BEGIN:VCARD\n"
        + "VERSION:3.0\n"
        + "FN:"
        + displayName
        + "\n"
        + "EMAIL;TYPE=Work:"
        + nullToEmpty(email)
        + "\n"
        + "TEL;type=CELL;type=VOICE;waid="
        + number
        + ":"
        + number
        + "\n"
        + "END:VCARD";
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }

  private static String emptyToNull(String s) {
    return s == null || s.isEmpty() ? null : s;
  }
}
